package com.phoenix.worker.repository;

import com.phoenix.worker.domain.GeneratedContentEntity;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface GeneratedContentRepository extends JpaRepository<GeneratedContentEntity, UUID> {
}
