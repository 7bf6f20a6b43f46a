package com.adharvest.listings.normalize;

import com.adharvest.listings.TestListings;
import com.adharvest.listings.model.FilterSet;
import com.adharvest.listings.model.LocationDescriptor;
import com.adharvest.listings.model.NormalizedRecord;
import com.adharvest.listings.model.OutputFormat;
import com.adharvest.listings.model.RawListing;
import com.adharvest.listings.model.SearchScope;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordNormalizerTest {

    private static final String AD_JSON = """
            {
              "list_id": 2512345678,
              "first_publication_date": "2024-05-30 18:12:05",
              "index_date": "2024-05-31T09:00:00",
              "status": "active",
              "category_id": "9",
              "category_name": "Ventes immobilières",
              "subject": "Maison 5 pièces 120 m²",
              "body": "Belle maison avec jardin",
              "ad_type": "offer",
              "url": "https://www.leboncoin.fr/ad/ventes_immobilieres/2512345678",
              "price": [320000],
              "price_cents": 32000000,
              "images": {
                "thumb_url": "https://img.example/thumb.jpg",
                "nb_images": 2,
                "urls_large": ["https://img.example/1.jpg", "https://img.example/2.jpg"]
              },
              "attributes": [
                {"key": "real_estate_type", "value": "1", "value_label": "Maison"},
                {"key": "square", "value": "120", "value_label": "120 m²"},
                {"key": "heatingType", "values": ["1", "2"], "values_label": ["Gaz", "Bois"]},
                {"value": "orphan"}
              ],
              "location": {
                "region_name": "Ile-de-France",
                "department_id": "92",
                "department_name": "Hauts-de-Seine",
                "city": "Nanterre",
                "zipcode": "92000",
                "lat": 48.88822,
                "lng": 2.19428,
                "source": "city"
              },
              "owner": {"store_id": "123", "user_id": "u-1", "type": "private", "name": "Jean"},
              "options": {"booster": true},
              "tracking": "drop-me"
            }
            """;

    private final RecordNormalizer normalizer = new RecordNormalizer(TestListings.CLOCK);
    private final SearchScope scope = new SearchScope("Nanterre", 0,
            new LocationDescriptor.City(48.88822, 2.19428, 4049, "Nanterre", "92000"),
            FilterSet.builder().category("9").text("maison").build());

    private RawListing ad() throws Exception {
        return new ObjectMapper().readValue(AD_JSON, RawListing.class);
    }

    @Test
    void shouldFlattenNestedStructuresWithPrefixes() throws Exception {
        NormalizedRecord record = normalizer.normalize(ad(), scope, OutputFormat.DETAILED);

        assertThat(record.id()).isEqualTo("2512345678");
        assertThat(record.get("id")).isEqualTo("2512345678");
        assertThat(record.get("price")).isEqualTo(320000L);
        assertThat(record.get("location_city")).isEqualTo("Nanterre");
        assertThat(record.get("location_department_name")).isEqualTo("Hauts-de-Seine");
        assertThat(record.get("owner_type")).isEqualTo("private");
        assertThat(record.get("attr_real_estate_type")).isEqualTo("Maison");
        assertThat(record.get("attr_square")).isEqualTo("120 m²");
        assertThat(record.get("attr_heating_type")).isEqualTo(List.of("Gaz", "Bois"));
        assertThat(record.get("images")).isEqualTo(List.of("https://img.example/1.jpg", "https://img.example/2.jpg"));
        assertThat(record.get("image_count")).isEqualTo(2);
    }

    @Test
    void shouldNormalizeDatesAndStampProvenance() throws Exception {
        NormalizedRecord record = normalizer.normalize(ad(), scope, OutputFormat.DETAILED);

        assertThat(record.get("first_publication_date")).isEqualTo("2024-05-30 18:12:05");
        assertThat(record.get("index_date")).isEqualTo("2024-05-31 09:00:00");
        assertThat(record.get("scraped_at")).isEqualTo("2024-06-01 12:00:00");
        assertThat(record.get("search_scope")).isEqualTo("Nanterre");
        assertThat(record.get("search_location")).isEqualTo("Nanterre 92000 (+4049m)");
        assertThat(record.get("search_category")).isEqualTo("9");
        assertThat(record.get("search_text")).isEqualTo("maison");
        assertThat(record.scopeLabel()).isEqualTo("Nanterre");
        assertThat(record.filters()).isEqualTo(scope.filters());
    }

    @Test
    void shouldDropFieldsOutsideTheSchema() throws Exception {
        NormalizedRecord record = normalizer.normalize(ad(), scope, OutputFormat.DETAILED);

        assertThat(record.fieldNames()).doesNotContain("options", "tracking", "location_source", "attr_");
        assertThat(record.fieldNames()).allMatch(name -> !name.contains("."));
    }

    @Test
    void shouldKeepEveryFixedKeyWhenNestedBlocksAreMissing() {
        RawListing bare = new RawListing();
        bare.setId("42");

        NormalizedRecord record = normalizer.normalize(bare, scope, OutputFormat.DETAILED);

        assertThat(record.fieldNames()).contains("location_city", "owner_type", "thumbnail_url", "price");
        assertThat(record.get("location_city")).isNull();
        assertThat(record.get("images")).isEqualTo(List.of());
        assertThat(record.get("image_count")).isEqualTo(0);
    }

    @Test
    void shouldProjectCompactAsSubsetOfDetailed() throws Exception {
        RawListing raw = ad();
        NormalizedRecord detailed = normalizer.normalize(raw, scope, OutputFormat.DETAILED);
        NormalizedRecord compact = normalizer.normalize(raw, scope, OutputFormat.COMPACT);

        assertThat(detailed.fieldNames()).containsAll(compact.fieldNames());
        assertThat(compact.fieldNames()).containsExactlyElementsOf(RecordNormalizer.COMPACT_FIELDS);
        assertThat(compact.id()).isEqualTo(detailed.id());
        for (String field : compact.fieldNames()) {
            assertThat(compact.get(field)).as(field).isEqualTo(detailed.get(field));
        }
    }

    @Test
    void shouldFilterNullImageUrls() {
        RawListing raw = new RawListing();
        raw.setId("7");
        RawListing.Images images = new RawListing.Images();
        images.setUrls(Arrays.asList("https://img.example/a.jpg", null));
        raw.setImages(images);

        NormalizedRecord record = normalizer.normalize(raw, scope, OutputFormat.DETAILED);

        assertThat(record.get("images")).isEqualTo(List.of("https://img.example/a.jpg"));
        assertThat(record.get("image_count")).isEqualTo(1);
    }

    @Test
    void shouldRejectListingWithoutId() {
        assertThatThrownBy(() -> normalizer.normalize(new RawListing(), scope, OutputFormat.COMPACT))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
