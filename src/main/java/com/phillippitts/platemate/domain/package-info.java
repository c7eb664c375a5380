/**
 * Domain model: chat messages, restaurant entities, coordinates and location fixes.
 */
package com.phillippitts.platemate.domain;
