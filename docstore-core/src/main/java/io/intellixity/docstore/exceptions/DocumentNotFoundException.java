package io.intellixity.docstore.exceptions;

public final class DocumentNotFoundException extends DocStoreException {
  private final String collection;
  private final String id;

  public DocumentNotFoundException(String collection, String id) {
    super("Document '" + id + "' not found in collection '" + collection + "'");
    this.collection = collection;
    this.id = id;
  }

  public String collection() { return collection; }
  public String id() { return id; }
}
