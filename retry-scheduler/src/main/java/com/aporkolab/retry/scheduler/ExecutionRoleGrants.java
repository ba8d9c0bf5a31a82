package com.aporkolab.retry.scheduler;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Which destinations each execution role may deliver to.
 * 
 * A schedule runs as its execution role, not as whoever created it, so a role
 * granted only the intake destination can never be used to deliver anywhere else.
 */
public class ExecutionRoleGrants {

    private final Map<String, Set<String>> grants;

    public ExecutionRoleGrants(Map<String, ? extends Collection<String>> grants) {
        Map<String, Set<String>> copy = new HashMap<>();
        if (grants != null) {
            grants.forEach((role, destinations) -> copy.put(role, Set.copyOf(destinations)));
        }
        this.grants = Map.copyOf(copy);
    }

    public static ExecutionRoleGrants single(String role, String destination) {
        return new ExecutionRoleGrants(Map.of(role, Set.of(destination)));
    }

    public boolean isAllowed(String role, String destination) {
        if (role == null || destination == null) {
            return false;
        }
        return grants.getOrDefault(role, Set.of()).contains(destination);
    }

    public Set<String> destinationsOf(String role) {
        return grants.getOrDefault(role, Set.of());
    }

    @Override
    public String toString() {
        return "ExecutionRoleGrants" + grants;
    }
}
