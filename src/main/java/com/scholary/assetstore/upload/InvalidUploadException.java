package com.scholary.assetstore.upload;

import com.scholary.assetstore.objectstore.ObjectStoreException;

/** Thrown when an inbound file is rejected before any remote call is made. */
public class InvalidUploadException extends ObjectStoreException {

  public InvalidUploadException(String message) {
    super(message);
  }
}
