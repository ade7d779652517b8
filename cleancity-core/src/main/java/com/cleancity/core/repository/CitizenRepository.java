package com.cleancity.core.repository;

import com.cleancity.core.domain.Citizen;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CitizenRepository extends JpaRepository<Citizen, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Citizen c WHERE c.deviceId = :deviceId")
    Optional<Citizen> findByIdForUpdate(@Param("deviceId") String deviceId);

    @Query("SELECT c FROM Citizen c WHERE c.totalPoints > 0 ORDER BY c.totalPoints DESC, c.firstSeen ASC")
    List<Citizen> findLeaders(Pageable pageable);

    @Query("SELECT c FROM Citizen c WHERE c.totalPoints > 0 AND c.area = :area " +
           "ORDER BY c.totalPoints DESC, c.firstSeen ASC")
    List<Citizen> findLeadersInArea(@Param("area") String area, Pageable pageable);

    @Query("SELECT COUNT(c) FROM Citizen c WHERE c.totalPoints > :points")
    long countWithMorePoints(@Param("points") int points);
}
