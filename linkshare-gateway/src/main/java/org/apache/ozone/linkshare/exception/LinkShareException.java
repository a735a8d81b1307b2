/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.ozone.linkshare.exception;

import java.io.IOException;

/**
 * Exception thrown while routing a link sharing request.
 *
 * The message carries internal detail for the server log. What the client
 * sees is decided by {@link ResultCodes#getHttpCode()} and
 * {@link ResultCodes#getPublicMessage()} only.
 */
public class LinkShareException extends IOException {

  private final ResultCodes result;

  public LinkShareException(String message, ResultCodes result) {
    super(message);
    this.result = result;
  }

  public LinkShareException(String message, Throwable cause,
      ResultCodes result) {
    super(message, cause);
    this.result = result;
  }

  public LinkShareException(Throwable cause, ResultCodes result) {
    super(cause);
    this.result = result;
  }

  public ResultCodes getResult() {
    return result;
  }

  @Override
  public String toString() {
    return result + " " + super.toString();
  }

  /**
   * Failure classes of the routing layer.
   */
  public enum ResultCodes {

    INVALID_CREDENTIAL(400, "invalid request: invalid access"),

    NON_PUBLIC_CREDENTIAL(400, "invalid request: non-public access key id"),

    UNSUPPORTED_CREDENTIAL_VERSION(400,
        "invalid request: invalid access version"),

    MISSING_CREDENTIAL(400, "invalid request: missing access"),

    MISSING_BUCKET(400, "invalid request: missing bucket"),

    INVALID_HOST(400, "invalid request: malformed host"),

    METHOD_NOT_ALLOWED(405, "method not allowed"),

    BUCKET_NOT_FOUND(404, "Oops! Bucket not found."),

    OBJECT_NOT_FOUND(404, "Oops! Object not found."),

    DNS_RESOLUTION_FAILED(500, "unable to handle request"),

    CUSTOM_DOMAIN_NOT_CONFIGURED(500, "unable to handle request"),

    INTERNAL_FAILURE(500, "unable to handle request"),

    TIMEOUT(504, "request timed out");

    private final int httpCode;
    private final String publicMessage;

    ResultCodes(int httpCode, String publicMessage) {
      this.httpCode = httpCode;
      this.publicMessage = publicMessage;
    }

    public int getHttpCode() {
      return httpCode;
    }

    public String getPublicMessage() {
      return publicMessage;
    }

    /**
     * Request-grammar and credential failures. These never succeed on a
     * retry of the same request.
     */
    public boolean isClientError() {
      return httpCode >= 400 && httpCode < 500;
    }

    public boolean isNotFound() {
      return httpCode == 404;
    }
  }
}
