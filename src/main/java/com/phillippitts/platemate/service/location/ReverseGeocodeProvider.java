package com.phillippitts.platemate.service.location;

import com.phillippitts.platemate.domain.Coordinate;

import java.util.concurrent.CompletableFuture;

/**
 * Turns a coordinate into a human-readable place. Failures complete the future exceptionally
 * with {@link com.phillippitts.platemate.exception.GeocodeException}.
 */
public interface ReverseGeocodeProvider {

    CompletableFuture<Placemark> resolve(Coordinate coordinate);
}
