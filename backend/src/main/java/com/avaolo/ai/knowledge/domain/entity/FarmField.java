package com.avaolo.ai.knowledge.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A field owned by a farmer, with the crop currently grown on it. */
@Entity
@Table(name = "farm_fields")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FarmField {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private Long farmerId;

  @Column(nullable = false)
  private String fieldName;

  private String crop;

  private String variety;

  private Double areaHectares;

  private LocalDate plantingDate;

  private LocalDateTime updatedAt;

  @PrePersist
  @PreUpdate
  protected void onSave() {
    updatedAt = LocalDateTime.now();
  }
}
