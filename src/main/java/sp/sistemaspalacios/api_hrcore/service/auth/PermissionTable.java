package sp.sistemaspalacios.api_hrcore.service.auth;

import sp.sistemaspalacios.api_hrcore.entity.auth.Capability;
import sp.sistemaspalacios.api_hrcore.entity.auth.UserRole;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable role to capability table.
 */
public class PermissionTable {

    private final Map<UserRole, Set<Capability>> grants;

    public PermissionTable(Map<UserRole, Set<Capability>> grants) {
        Map<UserRole, Set<Capability>> copy = new EnumMap<>(UserRole.class);
        grants.forEach((role, capabilities) -> copy.put(role,
                capabilities.isEmpty()
                        ? Collections.emptySet()
                        : Collections.unmodifiableSet(EnumSet.copyOf(capabilities))));
        this.grants = Collections.unmodifiableMap(copy);
    }

    public Set<Capability> capabilitiesOf(UserRole role) {
        return grants.getOrDefault(role, Collections.emptySet());
    }

    public boolean grants(UserRole role, Capability capability) {
        return capabilitiesOf(role).contains(capability);
    }
}
