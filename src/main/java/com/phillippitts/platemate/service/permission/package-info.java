/**
 * Permission providers for location and microphone access.
 */
package com.phillippitts.platemate.service.permission;
