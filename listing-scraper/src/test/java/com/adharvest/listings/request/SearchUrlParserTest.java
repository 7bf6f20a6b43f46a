package com.adharvest.listings.request;

import com.adharvest.listings.error.ConfigurationException;
import com.adharvest.listings.location.LocationSpec;
import com.adharvest.listings.location.LocationType;
import com.adharvest.listings.model.OwnerType;
import com.adharvest.listings.model.SortOrder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchUrlParserTest {

    private final SearchUrlParser parser = new SearchUrlParser();

    @Test
    void shouldParseSearchFieldsAndFilters() {
        ScrapeRequest request = parser.parse("https://www.leboncoin.fr/recherche?category=9&text=maison%20jardin"
                + "&price=100000-300000&square=50-max&real_estate_type=1,2&owner_type=private&page=3");

        assertThat(request.getCategory()).isEqualTo("9");
        assertThat(request.getText()).isEqualTo("maison jardin");
        assertThat(request.getPriceMin()).isEqualTo(100_000L);
        assertThat(request.getPriceMax()).isEqualTo(300_000L);
        assertThat(request.getOwnerType()).isEqualTo(OwnerType.PRIVATE);
        assertThat(request.getFilters()).containsOnlyKeys("square", "real_estate_type");
        assertThat(request.getFilters().get("real_estate_type")).isEqualTo(List.of("1", "2"));
        @SuppressWarnings("unchecked")
        Map<String, Object> square = (Map<String, Object>) request.getFilters().get("square");
        assertThat(square).containsEntry("min", 50L).containsEntry("max", null);
        assertThat(request.getLocationType()).isEqualTo(LocationType.NONE);
    }

    @Test
    void shouldParseCityTokenWithCoordinatesAndRadius() {
        ScrapeRequest request = parser.parse("/recherche?locations=Nanterre_92000__48.88822_2.19428_4049");

        assertThat(request.getLocationType()).isEqualTo(LocationType.CITY);
        assertThat(request.getLocations()).containsExactly(LocationSpec.builder()
                .city("Nanterre").zipcode("92000").lat(48.88822).lng(2.19428).radius(4049).build());
    }

    @Test
    void shouldTakeFirstOfTwoRadiusValues() {
        ScrapeRequest request = parser.parse("/recherche?locations=Lyon__45.76404_4.83566_7308_5000");

        assertThat(request.getLocations()).singleElement()
                .satisfies(spec -> assertThat(spec.getRadius()).isEqualTo(7308));
    }

    @Test
    void shouldUseZeroRadiusWhenTokenHasNone() {
        ScrapeRequest withCoordinates = parser.parse("/recherche?locations=Lyon__45.76404_4.83566");
        ScrapeRequest knownCity = parser.parse("/recherche?locations=Lyon_69000");

        assertThat(withCoordinates.getLocations().get(0).getRadius()).isZero();
        assertThat(knownCity.getLocations().get(0).getRadius()).isZero();
        assertThat(knownCity.getLocations().get(0).getLat()).isEqualTo(45.7640);
    }

    @Test
    void shouldCompleteKnownCityWithoutCoordinates() {
        ScrapeRequest request = parser.parse("/recherche?locations=Saint-Etienne_42000");

        LocationSpec spec = request.getLocations().get(0);
        assertThat(spec.getCity()).isEqualTo("Saint-Etienne");
        assertThat(spec.getZipcode()).isEqualTo("42000");
        assertThat(spec.getLat()).isEqualTo(45.4397);
    }

    @Test
    void shouldRejectUnknownCityWithoutCoordinates() {
        assertThatThrownBy(() -> parser.parse("/recherche?locations=Trifouillis_12345"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Trifouillis");
    }

    @Test
    void shouldParseDepartmentAndRegionTokens() {
        ScrapeRequest departments = parser.parse("/recherche?locations=d_75,d_92");
        ScrapeRequest regions = parser.parse("/recherche?locations=r_Ile_de_France");

        assertThat(departments.getLocationType()).isEqualTo(LocationType.DEPARTMENT);
        assertThat(departments.getLocations()).extracting(LocationSpec::getCode).containsExactly("75", "92");
        assertThat(regions.getLocationType()).isEqualTo(LocationType.REGION);
        assertThat(regions.getLocations()).extracting(LocationSpec::getName).containsExactly("Ile de France");
    }

    @Test
    void shouldRejectMixedLocationKinds() {
        assertThatThrownBy(() -> parser.parse("/recherche?locations=d_75,r_Bretagne"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldMapSortAndOrder() {
        assertThat(parser.parse("/recherche?sort=time&order=asc").getSort()).isEqualTo(SortOrder.OLDEST);
        assertThat(parser.parse("/recherche?sort=time").getSort()).isEqualTo(SortOrder.NEWEST);
        assertThat(parser.parse("/recherche?sort=price&order=desc").getSort()).isEqualTo(SortOrder.EXPENSIVE);
        assertThat(parser.parse("/recherche?sort=price").getSort()).isEqualTo(SortOrder.CHEAPEST);
    }

    @Test
    void shouldTreatSinglePriceAsExactBound() {
        ScrapeRequest request = parser.parse("/recherche?price=1500");

        assertThat(request.getPriceMin()).isEqualTo(1500L);
        assertThat(request.getPriceMax()).isEqualTo(1500L);
    }

    @Test
    void shouldRejectUrlWithoutQuery() {
        assertThatThrownBy(() -> parser.parse("https://www.leboncoin.fr/recherche"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> parser.parse(" "))
                .isInstanceOf(ConfigurationException.class);
    }
}
