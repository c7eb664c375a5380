/**
 * Spring configuration: thread pools, collaborator wiring and typed properties.
 */
package com.phillippitts.platemate.config;
