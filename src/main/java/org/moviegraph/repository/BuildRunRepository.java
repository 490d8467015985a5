package org.moviegraph.repository;

import org.moviegraph.models.entity.BuildRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BuildRunRepository extends JpaRepository<BuildRun, Long> {
    Optional<BuildRun> findByRunUid(String runUid);

    Optional<BuildRun> findTopByOrderByStartedAtDesc();

    List<BuildRun> findAllByOrderByStartedAtDesc();
}
