/**
 * Typed, validated configuration properties bound from application.properties.
 */
package com.phillippitts.platemate.config.properties;
