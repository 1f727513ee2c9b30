package io.tsbench.query.index;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Truck layout of the IoT use case.
 */
public final class IotSchema {

    public static final String READINGS = "readings";
    public static final String DIAGNOSTICS = "diagnostics";
    public static final String NAME = "name";

    public static final List<String> READINGS_FIELDS = List.of(
            "latitude", "longitude", "elevation", "velocity", "heading", "grade", "fuel_consumption");
    public static final List<String> DIAGNOSTICS_FIELDS = List.of("load", "fuel_state");
    /** Integer valued diagnostics field, stored in the bigint table. */
    public static final String STATUS = "status";

    public static final List<String> FLEETS = List.of("East", "West", "North", "South");
    static final List<String> DRIVERS = List.of("Albert", "Andy", "Seth", "Trish", "Derek", "Rodney");

    private IotSchema() {
    }

    public static String truckName(int truck) {
        return "truck_" + truck;
    }

    public static Map<String, String> truckTags(int truck) {
        var tags = new LinkedHashMap<String, String>();
        tags.put(NAME, truckName(truck));
        tags.put("fleet", FLEETS.get(truck % FLEETS.size()));
        tags.put("driver", DRIVERS.get(truck % DRIVERS.size()));
        return tags;
    }
}
