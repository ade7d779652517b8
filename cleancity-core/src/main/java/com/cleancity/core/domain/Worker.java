package com.cleancity.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "workers", indexes = {
    @Index(name = "idx_workers_phone", columnList = "phone", unique = true)
})
public class Worker {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @NotNull
    @Column(name = "phone", nullable = false, unique = true, length = 20)
    private String phone;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "worker_zones", joinColumns = @JoinColumn(name = "worker_id"))
    @Column(name = "zone", nullable = false, length = 100)
    private Set<String> assignedZones = new LinkedHashSet<>();

    @Column(name = "active", nullable = false)
    private boolean active;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    protected Worker() {}

    public static Worker create(String name, String phone, Collection<String> zones, Instant now) {
        var worker = new Worker();
        worker.name = name;
        worker.phone = phone;
        if (zones != null) {
            worker.assignedZones.addAll(zones);
        }
        worker.active = true;
        worker.createdAt = now;
        return worker;
    }

    public boolean covers(String area) {
        return area != null && assignedZones.contains(area);
    }

    public void deactivate() {
        this.active = false;
    }

    public UUID getId() { return id; }
    public String getName() { return name; }
    public String getPhone() { return phone; }
    public Set<String> getAssignedZones() { return Collections.unmodifiableSet(assignedZones); }
    public boolean isActive() { return active; }
    public Instant getCreatedAt() { return createdAt; }
}
