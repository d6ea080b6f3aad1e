package com.disasterfeed.sync.service;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.operation.valid.IsValidOp;
import org.locationtech.jts.operation.valid.TopologyValidationError;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Checks a geometry is fit for the spatial store before any transaction opens.
 *
 * @see #validate(Geometry)
 */
@Component
public class GeometryValidator {

    /**
     * @return the reason the geometry is rejected, or empty when it is acceptable
     */
    public Optional<String> validate(Geometry geometry) {
        if (geometry == null) {
            return Optional.of("missing geometry");
        }
        if (geometry.isEmpty()) {
            return Optional.of("empty " + geometry.getGeometryType());
        }
        for (Coordinate c : geometry.getCoordinates()) {
            if (!Double.isFinite(c.x) || !Double.isFinite(c.y)) {
                return Optional.of("non-finite coordinate " + c);
            }
            if (c.x < -180 || c.x > 180 || c.y < -90 || c.y > 90) {
                return Optional.of("coordinate out of range (lon " + c.x + ", lat " + c.y + ")");
            }
        }
        TopologyValidationError error = new IsValidOp(geometry).getValidationError();
        if (error != null) {
            return Optional.of("invalid " + geometry.getGeometryType() + ": " + error.getMessage());
        }
        if (geometry.getDimension() == 2 && geometry.getArea() <= 0) {
            return Optional.of("degenerate " + geometry.getGeometryType() + " (zero area)");
        }
        if (geometry.getDimension() == 1 && geometry.getLength() <= 0) {
            return Optional.of("degenerate " + geometry.getGeometryType() + " (zero length)");
        }
        return Optional.empty();
    }
}
