// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.identity;

/**
 * The platform metadata backend.
 */
public interface PlatformMetadataSource {

    /** Returns the platform metadata of the named node */
    PlatformMetadata metadata(String nodeName);

}
