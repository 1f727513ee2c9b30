package io.tsbench.query.index;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Host layout of the devops use case. Shared by the catalog and the point generator so
 * generated series ids and catalog entries agree.
 */
public final class DevopsSchema {

    public static final String CPU = "cpu";
    public static final String HOSTNAME = "hostname";

    public static final List<String> CPU_FIELDS = List.of(
            "usage_user", "usage_system", "usage_idle", "usage_nice", "usage_iowait",
            "usage_irq", "usage_softirq", "usage_steal", "usage_guest", "usage_guest_nice");

    static final List<String> REGIONS = List.of(
            "us-east-1", "us-west-1", "us-west-2", "eu-west-1", "eu-central-1",
            "ap-southeast-1", "ap-southeast-2", "ap-northeast-1", "sa-east-1");

    static final Map<String, List<String>> DATACENTERS = Map.of(
            "us-east-1", List.of("us-east-1a", "us-east-1b", "us-east-1c", "us-east-1e"),
            "us-west-1", List.of("us-west-1a", "us-west-1b"),
            "us-west-2", List.of("us-west-2a", "us-west-2b", "us-west-2c"),
            "eu-west-1", List.of("eu-west-1a", "eu-west-1b", "eu-west-1c"),
            "eu-central-1", List.of("eu-central-1a", "eu-central-1b"),
            "ap-southeast-1", List.of("ap-southeast-1a", "ap-southeast-1b"),
            "ap-southeast-2", List.of("ap-southeast-2a", "ap-southeast-2b"),
            "ap-northeast-1", List.of("ap-northeast-1a", "ap-northeast-1c"),
            "sa-east-1", List.of("sa-east-1a", "sa-east-1b", "sa-east-1c"));

    private DevopsSchema() {
    }

    public static String hostname(int host) {
        return "host_" + host;
    }

    /**
     * Tags of host number {@code host}, in series id order.
     */
    public static Map<String, String> hostTags(int host) {
        var region = REGIONS.get(host % REGIONS.size());
        var datacenters = DATACENTERS.get(region);
        var tags = new LinkedHashMap<String, String>();
        tags.put(HOSTNAME, hostname(host));
        tags.put("region", region);
        tags.put("datacenter", datacenters.get((host / REGIONS.size()) % datacenters.size()));
        return tags;
    }
}
