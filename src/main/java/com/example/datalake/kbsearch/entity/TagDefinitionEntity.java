package com.example.datalake.kbsearch.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "knowledge_base_tag_definitions", schema = "public")
@Data
public class TagDefinitionEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "knowledge_base_id", nullable = false)
    private String knowledgeBaseId;

    /**
     * Slot key such as tag1, number2 or boolean3
     */
    @Column(name = "tag_slot", nullable = false)
    private String tagSlot;

    @Column(name = "display_name", nullable = false)
    private String displayName;

    @Column(name = "field_type", nullable = false)
    private String fieldType;
}
