package com.starscape.imagepipeline.features.changestream.infra;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChangeLogEntryRepository extends JpaRepository<ChangeLogEntry, Long> {

    @Query("SELECT e FROM ChangeLogEntry e WHERE e.sequence > :after ORDER BY e.sequence ASC")
    List<ChangeLogEntry> findEntriesAfter(@Param("after") long after, Pageable page);
}
