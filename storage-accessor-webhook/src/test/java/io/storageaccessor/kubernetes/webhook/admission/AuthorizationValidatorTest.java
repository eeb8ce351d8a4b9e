/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.admission;

import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.storageaccessor.kubernetes.api.tenant.v1alpha1.Workspace;
import io.storageaccessor.kubernetes.api.v1alpha1.Accessor;
import io.storageaccessor.kubernetes.api.v1alpha1.accessorspec.FieldExpression;
import io.storageaccessor.kubernetes.api.v1alpha1.accessorspec.FieldRuleGroup;
import io.storageaccessor.kubernetes.api.v1alpha1.accessorspec.LabelRuleGroup;
import io.storageaccessor.kubernetes.api.v1alpha1.accessorspec.MatchExpression;
import io.storageaccessor.kubernetes.api.v1alpha1.accessorspec.ScopeSelector;
import io.storageaccessor.kubernetes.webhook.resolver.ClusterLookup;
import io.storageaccessor.kubernetes.webhook.resolver.ScopeNotFoundException;
import io.storageaccessor.kubernetes.webhook.resolver.ScopeResolver;

import static io.storageaccessor.kubernetes.webhook.Fixtures.accessor;
import static io.storageaccessor.kubernetes.webhook.Fixtures.namespace;
import static io.storageaccessor.kubernetes.webhook.Fixtures.namespaceInWorkspace;
import static io.storageaccessor.kubernetes.webhook.Fixtures.workspace;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthorizationValidatorTest {

    private static final ScopeSelector PROD_NAMESPACES = ScopeSelector.labels(LabelRuleGroup.allOf(MatchExpression.in("env", "prod")));
    private static final ScopeSelector NOT_RESTRICTED_WORKSPACE = ScopeSelector.fields(FieldRuleGroup.allOf(FieldExpression.notIn("name", "restricted-ws")));

    @Mock
    ClusterLookup clusterLookup;

    private AuthorizationValidator validator;

    @BeforeEach
    void setUp() {
        validator = new AuthorizationValidator(new ScopeResolver(clusterLookup));
    }

    private static ClaimRequest claimIn(String namespace) {
        return new ClaimRequest("PersistentVolumeClaim", "data", namespace, "CREATE", "fast-ssd");
    }

    @Test
    void shouldAuthorizeNamespaceMatchingSelector() {
        // Given
        when(clusterLookup.getNamespace("checkout")).thenReturn(Optional.of(namespace("checkout", Map.of("env", "prod"))));
        Accessor accessor = accessor("prod-only", "fast-ssd", PROD_NAMESPACES, null);

        // When
        var result = validator.authorize(claimIn("checkout"), accessor);

        // Then
        assertThat(result.authorized()).isTrue();
        assertThat(result.denialReason()).isEmpty();
    }

    @Test
    void shouldDenyNamespaceNotMatchingSelector() {
        // Given
        when(clusterLookup.getNamespace("sandbox")).thenReturn(Optional.of(namespace("sandbox", Map.of("env", "dev"))));
        Accessor accessor = accessor("prod-only", "fast-ssd", PROD_NAMESPACES, null);

        // When
        var result = validator.authorize(claimIn("sandbox"), accessor);

        // Then
        assertThat(result.authorized()).isFalse();
        assertThat(result.reason()).isEqualTo("PersistentVolumeClaim data (CREATE) in namespace sandbox is not permitted to use storage class fast-ssd: "
                + "namespace sandbox does not satisfy the namespaceSelector of Accessor prod-only");
        verify(clusterLookup, never()).getWorkspace(anyString());
    }

    @Test
    void shouldDenyWorkspaceNotMatchingSelector() {
        // Given
        when(clusterLookup.getNamespace("team-a")).thenReturn(Optional.of(namespaceInWorkspace("team-a", "restricted-ws")));
        when(clusterLookup.getWorkspace("restricted-ws")).thenReturn(Optional.of(workspace("restricted-ws")));
        Accessor accessor = accessor("open-workspaces", "fast-ssd", null, NOT_RESTRICTED_WORKSPACE);

        // When
        var result = validator.authorize(claimIn("team-a"), accessor);

        // Then
        assertThat(result.authorized()).isFalse();
        assertThat(result.reason())
                .contains("namespace team-a")
                .contains("storage class fast-ssd")
                .endsWith("workspace restricted-ws of namespace team-a does not satisfy the workspaceSelector of Accessor open-workspaces");
    }

    @Test
    void shouldAuthorizeWorkspaceMatchingSelector() {
        // Given
        when(clusterLookup.getNamespace("team-b")).thenReturn(Optional.of(namespaceInWorkspace("team-b", "open-ws")));
        when(clusterLookup.getWorkspace("open-ws")).thenReturn(Optional.of(workspace("open-ws")));
        Accessor accessor = accessor("open-workspaces", "fast-ssd", null, NOT_RESTRICTED_WORKSPACE);

        // When
        var result = validator.authorize(claimIn("team-b"), accessor);

        // Then
        assertThat(result.authorized()).isTrue();
    }

    @Test
    void shouldSkipWorkspaceCheckForNamespaceWithoutWorkspace() {
        // Given
        when(clusterLookup.getNamespace("team-c")).thenReturn(Optional.of(namespace("team-c", Map.of())));
        Accessor accessor = accessor("open-workspaces", "fast-ssd", null, NOT_RESTRICTED_WORKSPACE);

        // When
        var result = validator.authorize(claimIn("team-c"), accessor);

        // Then
        assertThat(result.authorized()).isTrue();
        verify(clusterLookup, never()).getWorkspace(anyString());
    }

    @Test
    void shouldTreatEmptyWorkspaceLabelAsNoWorkspace() {
        // Given
        when(clusterLookup.getNamespace("team-d")).thenReturn(Optional.of(namespace("team-d", Map.of(Workspace.WORKSPACE_LABEL, ""))));
        Accessor accessor = accessor("open-workspaces", "fast-ssd", null, NOT_RESTRICTED_WORKSPACE);

        // When
        var result = validator.authorize(claimIn("team-d"), accessor);

        // Then
        assertThat(result.authorized()).isTrue();
        verify(clusterLookup, never()).getWorkspace(anyString());
    }

    @Test
    void shouldPropagateMissingWorkspace() {
        // Given
        when(clusterLookup.getNamespace("team-e")).thenReturn(Optional.of(namespaceInWorkspace("team-e", "gone-ws")));
        when(clusterLookup.getWorkspace("gone-ws")).thenReturn(Optional.empty());
        Accessor accessor = accessor("open-workspaces", "fast-ssd", null, NOT_RESTRICTED_WORKSPACE);
        var claim = claimIn("team-e");

        // When
        // Then
        assertThatThrownBy(() -> validator.authorize(claim, accessor))
                .isInstanceOf(ScopeNotFoundException.class)
                .hasMessage("workspace gone-ws not found");
    }

    @Test
    void shouldPropagateMissingNamespace() {
        // Given
        when(clusterLookup.getNamespace("ghost")).thenReturn(Optional.empty());
        Accessor accessor = accessor("prod-only", "fast-ssd", PROD_NAMESPACES, null);
        var claim = claimIn("ghost");

        // When
        // Then
        assertThatThrownBy(() -> validator.authorize(claim, accessor))
                .isInstanceOf(ScopeNotFoundException.class)
                .hasMessage("namespace ghost not found");
    }

    @Test
    void shouldAuthorizeAccessorWithoutSelectors() {
        // Given
        when(clusterLookup.getNamespace("team-b")).thenReturn(Optional.of(namespaceInWorkspace("team-b", "open-ws")));
        when(clusterLookup.getWorkspace("open-ws")).thenReturn(Optional.of(workspace("open-ws")));
        Accessor accessor = accessor("anything", "fast-ssd", null, null);

        // When
        var result = validator.authorize(claimIn("team-b"), accessor);

        // Then
        assertThat(result.authorized()).isTrue();
    }
}
