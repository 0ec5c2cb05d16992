// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.identity;

import java.util.List;

/**
 * The node labels owned by the identity synchronizer. No other label is ever written or removed by it.
 */
public class ManagedLabels {

    public static final String clusterName = "node.cloudprovider.kubernetes.io/clustername";
    public static final String platform = "node.cloudprovider.kubernetes.io/platform";
    public static final String lifecycle = "node.cloudprovider.kubernetes.io/lifecycle";

    /** Value of the lifecycle label on spot instances */
    public static final String spotLifecycle = "spot";

    static final List<String> all = List.of(clusterName, platform, lifecycle);

    private ManagedLabels() {}

}
