// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.address;

import java.util.List;

/**
 * Reports the addresses currently assigned to the interfaces of a node.
 */
public interface AddressDiscovery {

    /** Returns the addresses of the named node, in the order they were assigned */
    List<ObservedAddress> addresses(String nodeName);

}
