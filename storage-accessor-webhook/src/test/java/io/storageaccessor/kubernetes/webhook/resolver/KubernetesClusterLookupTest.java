/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.resolver;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.base.CustomResourceDefinitionContext;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;

import io.storageaccessor.kubernetes.api.tenant.v1alpha1.Workspace;
import io.storageaccessor.kubernetes.api.v1alpha1.Accessor;
import io.storageaccessor.kubernetes.api.v1alpha1.accessorspec.LabelRuleGroup;
import io.storageaccessor.kubernetes.api.v1alpha1.accessorspec.MatchExpression;
import io.storageaccessor.kubernetes.api.v1alpha1.accessorspec.ScopeSelector;

import static io.storageaccessor.kubernetes.webhook.Fixtures.accessor;
import static io.storageaccessor.kubernetes.webhook.Fixtures.namespace;
import static io.storageaccessor.kubernetes.webhook.Fixtures.workspace;
import static org.assertj.core.api.Assertions.assertThat;

@EnableKubernetesMockClient(crud = true)
class KubernetesClusterLookupTest {

    KubernetesClient kubeClient;
    KubernetesMockServer mockServer;

    private KubernetesClusterLookup lookup;

    @BeforeEach
    void setUp() {
        mockServer.expectCustomResource(CustomResourceDefinitionContext.fromCustomResourceType(Accessor.class));
        mockServer.expectCustomResource(CustomResourceDefinitionContext.fromCustomResourceType(Workspace.class));
        lookup = new KubernetesClusterLookup(kubeClient);
    }

    @Test
    void shouldListAccessors() {
        // Given
        var selector = ScopeSelector.labels(LabelRuleGroup.allOf(MatchExpression.in("env", "prod")));
        kubeClient.resources(Accessor.class).resource(accessor("fast", "fast-ssd", selector, null)).create();
        kubeClient.resources(Accessor.class).resource(accessor("slow", "slow-hdd", null, null)).create();

        // When
        var accessors = lookup.listAccessors();

        // Then
        assertThat(accessors)
                .extracting(a -> a.getMetadata().getName())
                .containsExactlyInAnyOrder("fast", "slow");
        assertThat(accessors)
                .filteredOn(a -> a.getMetadata().getName().equals("fast"))
                .singleElement()
                .satisfies(a -> assertThat(a.getSpec().getNamespaceSelector()).isEqualTo(selector));
    }

    @Test
    void shouldListNoAccessorsInEmptyCluster() {
        assertThat(lookup.listAccessors()).isEmpty();
    }

    @Test
    void shouldGetNamespace() {
        // Given
        kubeClient.namespaces().resource(namespace("checkout", Map.of("env", "prod"))).create();

        // When
        var found = lookup.getNamespace("checkout");

        // Then
        assertThat(found).hasValueSatisfying(ns -> assertThat(ns.getMetadata().getLabels()).containsEntry("env", "prod"));
    }

    @Test
    void shouldReturnEmptyForMissingNamespace() {
        assertThat(lookup.getNamespace("nope")).isEmpty();
    }

    @Test
    void shouldGetWorkspace() {
        // Given
        kubeClient.resources(Workspace.class).resource(workspace("open-ws")).create();

        // When
        var found = lookup.getWorkspace("open-ws");

        // Then
        assertThat(found).hasValueSatisfying(ws -> assertThat(ws.getMetadata().getName()).isEqualTo("open-ws"));
        assertThat(lookup.getWorkspace("restricted-ws")).isEmpty();
    }
}
