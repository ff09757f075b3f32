package com.flamingo.ai.knowledge.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Source details of a knowledge document. File fields are set for uploaded files, URL fields for
 * crawled pages; the unused half stays null.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentSource {

  @Column(name = "file_name")
  private String fileName;

  /** Storage path of the uploaded artifact, removed when the document is deleted. */
  @Column(name = "file_path", length = 1000)
  private String filePath;

  @Column(name = "file_size")
  private Long fileSize;

  @Column(name = "mime_type", length = 100)
  private String mimeType;

  @Column(name = "source_url", columnDefinition = "TEXT")
  private String sourceUrl;

  @Column(name = "crawl_depth")
  private Integer crawlDepth;
}
