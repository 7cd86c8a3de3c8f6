package me.golemcore.runtime.domain.policy;

/**
 * Stable deny reason codes written into observations and trace payloads.
 */
public final class PolicyReasons {

    public static final String NETWORK_DISABLED = "network_disabled";
    public static final String DOMAIN_NOT_ALLOWED = "domain_not_allowed";
    public static final String WRITES_DISABLED = "writes_disabled";
    public static final String PATH_OUTSIDE_WORKSPACE = "path_outside_workspace";
    public static final String TOOL_DENIED = "tool_denied";

    private PolicyReasons() {
    }
}
