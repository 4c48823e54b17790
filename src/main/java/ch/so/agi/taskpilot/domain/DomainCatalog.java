package ch.so.agi.taskpilot.domain;

import java.util.List;

public record DomainCatalog(List<DomainDefinition> domains) {

    public DomainCatalog {
        domains = domains == null ? List.of() : List.copyOf(domains);
    }
}
