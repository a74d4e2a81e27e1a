package com.starscape.imagepipeline.features.changestream.infra;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ChangeStreamCursorRepository extends JpaRepository<ChangeStreamCursor, String> {
}
