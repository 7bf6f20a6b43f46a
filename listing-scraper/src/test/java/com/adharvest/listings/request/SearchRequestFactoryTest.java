package com.adharvest.listings.request;

import com.adharvest.listings.engine.RunPolicy;
import com.adharvest.listings.engine.StalePolicy;
import com.adharvest.listings.error.ConfigurationException;
import com.adharvest.listings.location.LocationResolver;
import com.adharvest.listings.location.LocationSpec;
import com.adharvest.listings.location.LocationType;
import com.adharvest.listings.model.FilterSet;
import com.adharvest.listings.model.FilterValue;
import com.adharvest.listings.model.LocationDescriptor;
import com.adharvest.listings.model.SearchScope;
import com.adharvest.listings.model.SortOrder;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchRequestFactoryTest {

    private final SearchRequestFactory factory =
            new SearchRequestFactory(new LocationResolver(), new SearchUrlParser(), 7);

    private static ScrapeRequest departments(String... codes) {
        ScrapeRequest request = new ScrapeRequest();
        request.setCategory("9");
        request.setLocationType(LocationType.DEPARTMENT);
        for (String code : codes) {
            request.getLocations().add(LocationSpec.builder().code(code).build());
        }
        return request;
    }

    @Test
    void shouldPrepareOneScopePerLocationWithSharedFilters() {
        SearchRequestFactory.PreparedRun run = factory.prepare(departments("75", "92"));

        assertThat(run.scopes()).hasSize(2);
        assertThat(run.scopes()).extracting(SearchScope::filters).allSatisfy(f -> assertThat(f.category()).isEqualTo("9"));
        assertThat(run.scopes().get(0).filters()).isSameAs(run.scopes().get(1).filters());
    }

    @Test
    void shouldApplyRequestDefaultsToPolicy() {
        RunPolicy policy = factory.prepare(departments("75")).policy();

        assertThat(policy.maxPages()).isEqualTo(10);
        assertThat(policy.pageSize()).isEqualTo(35);
        assertThat(policy.maxAge()).isNull();
        assertThat(policy.consecutiveStaleLimit()).isEqualTo(5);
        assertThat(policy.stalePolicy()).isEqualTo(StalePolicy.EMIT);
        assertThat(policy.errorThreshold()).isEqualTo(7);
    }

    @Test
    void shouldConvertFractionalMaxAgeDays() {
        ScrapeRequest request = departments("75");
        request.setMaxAgeDays(0.5);
        request.setErrorThreshold(0);

        RunPolicy policy = factory.prepare(request).policy();

        assertThat(policy.maxAge()).isEqualTo(Duration.ofHours(12));
        assertThat(policy.errorThreshold()).isZero();
    }

    @Test
    void shouldConvertLooseFilterValues() {
        ScrapeRequest request = departments("75");
        request.getFilters().put("square", Map.of("min", 50));
        request.getFilters().put("rooms", List.of(3, 4));
        request.getFilters().put("furnished", "1");
        request.setPriceMax(300_000L);

        FilterSet filters = factory.filters(request);

        assertThat(filters.attributes()).containsEntry("square", new FilterValue.Range(50L, null))
                .containsEntry("rooms", new FilterValue.ValueSet(List.of("3", "4")))
                .containsEntry("furnished", new FilterValue.Scalar("1"));
        assertThat(filters.price()).isEqualTo(new FilterValue.Range(null, 300_000L));
    }

    @Test
    void shouldRejectInvertedPriceRange() {
        ScrapeRequest request = departments("75");
        request.setPriceMin(500L);
        request.setPriceMax(100L);

        assertThatThrownBy(() -> factory.prepare(request)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldRejectOutOfRangeNumbers() {
        ScrapeRequest pageSize = departments("75");
        pageSize.setPageSize(100);
        ScrapeRequest maxPages = departments("75");
        maxPages.setMaxPages(-1);
        ScrapeRequest badRange = departments("75");
        badRange.getFilters().put("square", Map.of("min", "lots"));

        assertThatThrownBy(() -> factory.prepare(pageSize)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> factory.prepare(maxPages)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> factory.prepare(badRange)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldLetExplicitFieldsWinOverUrl() {
        ScrapeRequest request = new ScrapeRequest();
        request.setUrl("/recherche?category=9&text=maison&sort=price&locations=d_75&rooms=3,4");
        request.setText("appartement");
        request.getFilters().put("rooms", List.of("2"));

        SearchRequestFactory.PreparedRun run = factory.prepare(request);

        FilterSet filters = run.scopes().get(0).filters();
        assertThat(filters.category()).isEqualTo("9");
        assertThat(filters.text()).isEqualTo("appartement");
        assertThat(filters.sort()).isEqualTo(SortOrder.CHEAPEST);
        assertThat(filters.attributes().get("rooms")).isEqualTo(new FilterValue.ValueSet(List.of("2")));
        assertThat(run.scopes()).extracting(SearchScope::location)
                .containsExactly(new LocationDescriptor.Department("75"));
    }

    @Test
    void shouldRejectMissingRequest() {
        assertThatThrownBy(() -> factory.prepare(null)).isInstanceOf(ConfigurationException.class);
    }
}
