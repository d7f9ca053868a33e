// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/model/Coordinates.java
package dev.devanks.agronomy.eto.model;

import dev.devanks.agronomy.eto.exception.InvalidCoordinatesException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class Coordinates {

    public static final double CELL_SIZE_DEGREES = 0.5;

    private Coordinates() {
    }

    public static void validate(double latitude, double longitude) {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw new InvalidCoordinatesException("Latitude must be within [-90, 90] but was " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw new InvalidCoordinatesException("Longitude must be within [-180, 180] but was " + longitude);
        }
    }

    /**
     * Identifier of the 0.5° grid cell containing the point, e.g. {@code "19.5,73.5"}.
     */
    public static String regionCellId(double latitude, double longitude) {
        return cellId(floorToCell(latitude), floorToCell(longitude));
    }

    /**
     * The cell containing the point plus its eight neighbours.
     */
    public static List<String> neighbouringCellIds(double latitude, double longitude) {
        double latCell = floorToCell(latitude);
        double lonCell = floorToCell(longitude);
        List<String> cells = new ArrayList<>(9);
        for (int dLat = -1; dLat <= 1; dLat++) {
            for (int dLon = -1; dLon <= 1; dLon++) {
                cells.add(cellId(latCell + dLat * CELL_SIZE_DEGREES, lonCell + dLon * CELL_SIZE_DEGREES));
            }
        }
        return cells;
    }

    private static double floorToCell(double degrees) {
        // + 0.0 folds negative zero so the id never renders as "-0.0"
        return Math.floor(degrees / CELL_SIZE_DEGREES) * CELL_SIZE_DEGREES + 0.0;
    }

    private static String cellId(double latCell, double lonCell) {
        return String.format(Locale.ROOT, "%.1f,%.1f", latCell, lonCell);
    }
}
