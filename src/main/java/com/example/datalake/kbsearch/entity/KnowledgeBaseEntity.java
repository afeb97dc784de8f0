package com.example.datalake.kbsearch.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.Data;
import org.hibernate.annotations.Immutable;

/**
 * Read-only view of a knowledge base. Rows are owned by the ingestion side; this service never
 * writes them.
 */
@Entity
@Immutable
@Table(name = "knowledge_base", schema = "public")
@Data
public class KnowledgeBaseEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "workspace_id")
    private String workspaceId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;
}
