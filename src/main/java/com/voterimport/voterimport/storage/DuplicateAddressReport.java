package com.voterimport.voterimport.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Addresses at which at least {@code threshold} voters are registered.
 *
 * @param votersPerAddress number of addresses by voter count, largest count first
 */
public record DuplicateAddressReport(
        String table,
        int threshold,
        long totalAddresses,
        List<AddressGroup> groups,
        Map<Long, Long> votersPerAddress
) {

    public DuplicateAddressReport {
        groups = List.copyOf(groups);
        votersPerAddress = Collections.unmodifiableMap(new LinkedHashMap<>(votersPerAddress));
    }

    public long votersAtSharedAddresses() {
        return groups.stream().mapToLong(AddressGroup::voterCount).sum();
    }

    public record AddressGroup(String address, String city, String zip, long voterCount, List<Voter> voters) {

        public AddressGroup {
            voters = List.copyOf(voters);
        }
    }

    public record Voter(String voterId, String name, String registrationDate) {
    }
}
