package com.cleancity.core.repository;

import com.cleancity.core.domain.Worker;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface WorkerRepository extends JpaRepository<Worker, UUID> {

    boolean existsByPhone(String phone);
}
