// Copyright 2012 Benjamin Kalman
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.lman.mustache.template;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable settings for a render. Build with {@link #builder()}.
 */
public final class RenderOptions {

  public static final int DEFAULT_MAX_DEPTH = 256;

  public static final RenderOptions DEFAULTS = builder().build();

  public final static class Builder {
    private boolean escapeHtml = true;
    private MissingKeyPolicy onMissingKey = MissingKeyPolicy.IGNORE;
    private PartialSource partialSource = PartialSource.NONE;
    private Delimiters delimiters = Delimiters.DEFAULT;
    private boolean keepMissingTags = false;
    private int maxDepth = DEFAULT_MAX_DEPTH;
    private Logger logger = LoggerFactory.getLogger(Mustache.class);

    private Builder() {}

    private Builder(RenderOptions options) {
      this.escapeHtml = options.escapeHtml;
      this.onMissingKey = options.onMissingKey;
      this.partialSource = options.partialSource;
      this.delimiters = options.delimiters;
      this.keepMissingTags = options.keepMissingTags;
      this.maxDepth = options.maxDepth;
      this.logger = options.logger;
    }

    public Builder withEscapeHtml(boolean escapeHtml) {
      this.escapeHtml = escapeHtml;
      return this;
    }

    public Builder withNoEscape() {
      return withEscapeHtml(false);
    }

    public Builder withOnMissingKey(MissingKeyPolicy onMissingKey) {
      if (onMissingKey == null)
        throw new IllegalArgumentException("onMissingKey cannot be null");
      this.onMissingKey = onMissingKey;
      return this;
    }

    public Builder withPartialSource(PartialSource partialSource) {
      this.partialSource = partialSource == null ? PartialSource.NONE : partialSource;
      return this;
    }

    public Builder withPartials(Map<String, String> partials) {
      return withPartialSource(new MapPartialSource(partials));
    }

    public Builder withDelimiters(Delimiters delimiters) {
      if (delimiters == null)
        throw new IllegalArgumentException("delimiters cannot be null");
      this.delimiters = delimiters;
      return this;
    }

    public Builder withDelimiters(String open, String close) {
      return withDelimiters(new Delimiters(open, close));
    }

    public Builder withKeepMissingTags(boolean keepMissingTags) {
      this.keepMissingTags = keepMissingTags;
      return this;
    }

    public Builder withMaxDepth(int maxDepth) {
      if (maxDepth < 1)
        throw new IllegalArgumentException("maxDepth must be positive, was " + maxDepth);
      this.maxDepth = maxDepth;
      return this;
    }

    public Builder withLogger(Logger logger) {
      if (logger == null)
        throw new IllegalArgumentException("logger cannot be null");
      this.logger = logger;
      return this;
    }

    public RenderOptions build() {
      return new RenderOptions(this);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Whether {{foo}} escapes HTML. {{{foo}}} and {{&foo}} never do. */
  public final boolean escapeHtml;
  public final MissingKeyPolicy onMissingKey;
  public final PartialSource partialSource;
  /** The delimiters that templates, and every partial, start out with. */
  public final Delimiters delimiters;
  /** Whether a missing {{foo}} renders as itself rather than as nothing. */
  public final boolean keepMissingTags;
  public final int maxDepth;
  public final Logger logger;

  private RenderOptions(Builder builder) {
    this.escapeHtml = builder.escapeHtml;
    this.onMissingKey = builder.onMissingKey;
    this.partialSource = builder.partialSource;
    this.delimiters = builder.delimiters;
    this.keepMissingTags = builder.keepMissingTags;
    this.maxDepth = builder.maxDepth;
    this.logger = builder.logger;
  }

  /**
   * A builder that starts out with these options.
   */
  public Builder toBuilder() {
    return new Builder(this);
  }
}
