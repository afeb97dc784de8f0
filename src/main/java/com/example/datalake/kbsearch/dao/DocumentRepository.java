package com.example.datalake.kbsearch.dao;

import com.example.datalake.kbsearch.entity.DocumentEntity;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DocumentRepository extends JpaRepository<DocumentEntity, String> {

    /**
     * Batched name lookup; soft-deleted documents are left out.
     */
    List<DocumentEntity> findByIdInAndDeletedAtIsNull(Collection<String> ids);
}
