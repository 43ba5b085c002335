package com.labvault.lims.model;

import jakarta.persistence.*;

@Entity
@Table(name = "id_counters")
public class IdCounter {
    @Id
    @Column(name = "entity_type", length = 50)
    private String entityType;

    @Column(name = "last_number", nullable = false)
    private Integer lastValue;

    public IdCounter() {}

    public IdCounter(String entityType, Integer lastValue) {
        this.entityType = entityType;
        this.lastValue = lastValue;
    }

    public String getEntityType() { return entityType; }
    public void setEntityType(String entityType) { this.entityType = entityType; }
    public Integer getLastValue() { return lastValue; }
    public void setLastValue(Integer lastValue) { this.lastValue = lastValue; }
}
