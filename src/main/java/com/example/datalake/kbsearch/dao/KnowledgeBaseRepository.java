package com.example.datalake.kbsearch.dao;

import com.example.datalake.kbsearch.entity.KnowledgeBaseEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface KnowledgeBaseRepository extends JpaRepository<KnowledgeBaseEntity, String> {

    Optional<KnowledgeBaseEntity> findByIdAndDeletedAtIsNull(String id);
}
