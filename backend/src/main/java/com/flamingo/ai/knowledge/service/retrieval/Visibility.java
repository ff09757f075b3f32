package com.flamingo.ai.knowledge.service.retrieval;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;

/**
 * Which documents a caller may retrieve from.
 *
 * @param owner the calling user, or null for an anonymous caller
 * @param includeAdminManaged whether admin-managed documents are eligible
 * @param includeUserManaged whether the owner's own documents are eligible
 */
public record Visibility(String owner, boolean includeAdminManaged, boolean includeUserManaged) {

  /** Admin-managed documents only. */
  public static Visibility adminManagedOnly() {
    return new Visibility(null, true, false);
  }

  /** Admin-managed documents plus the owner's own uploads. */
  public static Visibility forOwner(String owner) {
    return new Visibility(owner, true, true);
  }

  public boolean permits(KnowledgeDocument document) {
    if (document.isAdminManaged()) {
      return includeAdminManaged;
    }
    return includeUserManaged && owner != null && owner.equals(document.getUploadedBy());
  }
}
