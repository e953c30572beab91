package com.findex.backend.service;

import com.findex.backend.config.ExportSettings;
import com.findex.backend.exception.RemoteServiceException;
import com.findex.backend.model.Region;
import com.findex.backend.service.aws.RegionCatalog;
import com.findex.backend.util.CancellationToken;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RegionResolverTest {

    private final RegionCatalog catalog = mock(RegionCatalog.class);
    private final RegionResolver resolver = new RegionResolver(catalog, ExportSettings.defaults(Path.of("unused")));

    @Test
    void defaultPrefixKeepsUsRegionsInProviderOrder() {
        when(catalog.describeRegions(any())).thenReturn(
                List.of("us-west-2", "eu-west-1", "us-east-1", "ap-south-1", "us-east-2"));

        assertThat(resolver.listRegions()).extracting(Region::name)
                .containsExactly("us-west-2", "us-east-1", "us-east-2");
    }

    @Test
    void customPrefixAndEmptyPrefix() {
        when(catalog.describeRegions(any())).thenReturn(List.of("us-east-1", "eu-west-1", "eu-central-1"));

        assertThat(resolver.listRegions("eu-", CancellationToken.none())).extracting(Region::name)
                .containsExactly("eu-west-1", "eu-central-1");
        assertThat(resolver.listRegions("", CancellationToken.none())).hasSize(3);
    }

    @Test
    void noMatchIsEmptyNotAnError() {
        when(catalog.describeRegions(any())).thenReturn(List.of("eu-west-1"));

        assertThat(resolver.listRegions()).isEmpty();
    }

    @Test
    void discoveryFailurePropagates() {
        when(catalog.describeRegions(any()))
                .thenThrow(new RemoteServiceException("DescribeRegions", "us-east-1", 403, "AuthFailure", null));

        assertThatThrownBy(resolver::listRegions)
                .isInstanceOf(RemoteServiceException.class)
                .hasMessageContaining("DescribeRegions");
    }
}
