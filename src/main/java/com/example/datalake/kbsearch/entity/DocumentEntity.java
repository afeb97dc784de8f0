package com.example.datalake.kbsearch.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.Data;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "document", schema = "public")
@Data
public class DocumentEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "knowledge_base_id", nullable = false)
    private String knowledgeBaseId;

    @Column(name = "filename", nullable = false)
    private String filename;

    /**
     * pending, processing, completed or failed
     */
    @Column(name = "processing_status", nullable = false)
    private String processingStatus;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;
}
