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

package org.apache.ozone.linkshare.routing;

import com.google.common.base.Preconditions;
import java.io.Closeable;
import java.io.IOException;
import org.apache.ozone.linkshare.storage.AccessGrant;
import org.apache.ozone.linkshare.storage.ObjectInfo;
import org.apache.ozone.linkshare.storage.StorageProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fully resolved request: which grant, bucket and key it refers to and
 * what has to be sent back.
 *
 * A result that carries an open {@link StorageProject} owns it; closing
 * the result closes the project.
 */
public final class RoutingResult implements Closeable {

  private static final Logger LOG =
      LoggerFactory.getLogger(RoutingResult.class);

  private final RoutingMode mode;
  private final RoutingAction action;
  private final AccessGrant access;
  private final String bucket;
  private final String key;
  private final ObjectInfo object;
  private final StorageProject project;
  private final String location;
  private final String listingTitle;
  private final String rootLabel;
  private final String rootUrl;
  private final String visiblePrefix;

  private RoutingResult(Builder b) {
    this.mode = b.mode;
    this.action = b.action;
    this.access = b.access;
    this.bucket = b.bucket;
    this.key = b.key;
    this.object = b.object;
    this.project = b.project;
    this.location = b.location;
    this.listingTitle = b.listingTitle;
    this.rootLabel = b.rootLabel;
    this.rootUrl = b.rootUrl;
    this.visiblePrefix = b.visiblePrefix;
  }

  public static Builder newBuilder(RoutingMode mode, RoutingAction action) {
    return new Builder(mode, action);
  }

  public RoutingMode getMode() {
    return mode;
  }

  public RoutingAction getAction() {
    return action;
  }

  public AccessGrant getAccess() {
    return access;
  }

  public String getBucket() {
    return bucket;
  }

  public String getKey() {
    return key;
  }

  /**
   * Metadata of the object to serve, set for {@code SERVE_OBJECT} and
   * for HEAD redirects.
   */
  public ObjectInfo getObject() {
    return object;
  }

  /**
   * Open project, set for {@code SERVE_OBJECT} and {@code LIST_PREFIX}.
   */
  public StorageProject getProject() {
    return project;
  }

  /**
   * Redirect target for the two redirect actions.
   */
  public String getLocation() {
    return location;
  }

  public String getListingTitle() {
    return listingTitle;
  }

  /**
   * Label of the first breadcrumb of a listing.
   */
  public String getRootLabel() {
    return rootLabel;
  }

  /**
   * Link of the first breadcrumb of a listing, ends with a slash.
   */
  public String getRootUrl() {
    return rootUrl;
  }

  /**
   * The part of the listed prefix the client sees in its URL.
   */
  public String getVisiblePrefix() {
    return visiblePrefix;
  }

  @Override
  public void close() {
    if (project == null) {
      return;
    }
    try {
      project.close();
    } catch (IOException e) {
      LOG.warn("unable to close project", e);
    }
  }

  @Override
  public String toString() {
    return "RoutingResult{mode=" + mode + ", action=" + action
        + ", bucket='" + bucket + "', key='" + key + "'}";
  }

  /**
   * Builder for {@link RoutingResult}.
   */
  public static final class Builder {
    private final RoutingMode mode;
    private final RoutingAction action;
    private AccessGrant access;
    private String bucket;
    private String key = "";
    private ObjectInfo object;
    private StorageProject project;
    private String location;
    private String listingTitle;
    private String rootLabel;
    private String rootUrl;
    private String visiblePrefix = "";

    private Builder(RoutingMode mode, RoutingAction action) {
      this.mode = Preconditions.checkNotNull(mode, "mode == null");
      this.action = Preconditions.checkNotNull(action, "action == null");
    }

    public Builder setAccess(AccessGrant accessGrant) {
      this.access = accessGrant;
      return this;
    }

    public Builder setBucket(String bucketName) {
      this.bucket = bucketName;
      return this;
    }

    public Builder setKey(String objectKey) {
      this.key = objectKey;
      return this;
    }

    public Builder setObject(ObjectInfo info) {
      this.object = info;
      return this;
    }

    public Builder setProject(StorageProject storageProject) {
      this.project = storageProject;
      return this;
    }

    public Builder setLocation(String redirectLocation) {
      this.location = redirectLocation;
      return this;
    }

    public Builder setListing(String title, String label, String url,
        String visible) {
      this.listingTitle = title;
      this.rootLabel = label;
      this.rootUrl = url;
      this.visiblePrefix = visible;
      return this;
    }

    public RoutingResult build() {
      switch (action) {
      case SERVE_OBJECT:
        Preconditions.checkState(project != null && object != null,
            "object results need a project and object metadata");
        Preconditions.checkState(bucket != null && !bucket.isEmpty(),
            "bucket must not be empty");
        break;
      case LIST_PREFIX:
        Preconditions.checkState(project != null,
            "listing results need a project");
        Preconditions.checkState(bucket != null && !bucket.isEmpty(),
            "bucket must not be empty");
        break;
      default:
        Preconditions.checkState(location != null,
            "redirect results need a location");
      }
      return new RoutingResult(this);
    }
  }
}
