package com.flamingo.ai.knowledge.domain.enums;

/** Kind of knowledge a document carries. */
public enum KnowledgeDocumentType {
  /** Vendor product documentation. */
  PRODUCT_DOCUMENTATION,

  /** Query language syntax guides. */
  QUERY_SYNTAX,

  /** Threat actor profiles, malware analysis. */
  THREAT_INTEL,

  /** Incident response and hunting playbooks. */
  PLAYBOOK,

  /** Policies and procedures. */
  POLICY,

  /** General reference material. */
  REFERENCE,

  /** Anything else, including user uploads. */
  CUSTOM
}
