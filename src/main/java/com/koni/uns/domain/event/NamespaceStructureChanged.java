package com.koni.uns.domain.event;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Published when the hierarchy or the namespace set changes. Consumers re-evaluate mappings
 * and rebuild derived views.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class NamespaceStructureChanged extends DomainEvent {

    private final String reason;

    public NamespaceStructureChanged(String reason) {
        super();
        this.reason = reason;
    }
}
