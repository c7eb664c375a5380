package com.phillippitts.platemate.service.extraction;

import com.phillippitts.platemate.domain.LocationFix;
import com.phillippitts.platemate.domain.RestaurantRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class EntityExtractorTest {

    private final EntityExtractor extractor = new EntityExtractor(new Random(42));

    @Test
    void shouldExtractSingleItalianRecommendation() {
        ExtractionResult result = extractor.extract("I recommend an Italian restaurant nearby", Optional.empty());

        assertThat(result.entities()).hasSize(1);
        assertThat(result.entities().get(0).getCuisines()).containsExactly("Italian");
    }

    @Test
    void shouldReturnNoEntitiesForSmallTalk() {
        ExtractionResult result = extractor.extract("The weather is nice today", Optional.empty());

        assertThat(result.entities()).isEmpty();
        assertThat(result.hasEntities()).isFalse();
    }

    @Test
    void shouldReturnNoEntitiesWithoutVenueKeyword() {
        String text = "Italian and Thai food are both great choices.";

        ExtractionResult result = extractor.extract(text, Optional.empty());

        assertThat(result.entities()).isEmpty();
        assertThat(result.passthroughText()).isEqualTo(text);
        assertThat(result.hasEntities()).isFalse();
    }

    @Test
    void shouldReturnNoEntitiesWithoutCuisine() {
        ExtractionResult result = extractor.extract("There is a lovely diner on the corner.", Optional.empty());

        assertThat(result.entities()).isEmpty();
    }

    @Test
    void shouldKeepCuisinesInOrderOfMention() {
        String text = "Try the Thai place on 5th, or a Mexican grill. For dessert, an Italian café.";

        ExtractionResult result = extractor.extract(text, Optional.empty());

        assertThat(result.entities())
                .extracting(r -> r.getCuisines().iterator().next())
                .containsExactly("Thai", "Mexican", "Italian");
        assertThat(result.passthroughText()).isEqualTo(text);
    }

    @Test
    void shouldMatchKeywordsCaseInsensitively() {
        ExtractionResult result = extractor.extract("JAPANESE RESTAURANT downtown", Optional.empty());

        assertThat(result.entities()).hasSize(1);
        assertThat(result.entities().get(0).getName()).startsWith("Japanese ");
    }

    @Test
    void shouldCapEntitiesAtFive() {
        String text = "Restaurants: Greek, French, Chinese, Indian, Japanese, Thai and Italian.";

        ExtractionResult result = extractor.extract(text, Optional.empty());

        assertThat(result.entities()).hasSize(EntityExtractor.MAX_ENTITIES);
        assertThat(result.entities())
                .extracting(r -> r.getCuisines().iterator().next())
                .containsExactly("Greek", "French", "Chinese", "Indian", "Japanese");
    }

    @Test
    void shouldPlaceRecordsNearFixAndMeasureDistance() {
        LocationFix fix = LocationFix.of(40.7128, -74.0060, 10.0);

        List<RestaurantRecord> records = extractor.extract("An Indian bistro and a Greek eatery", Optional.of(fix))
                .entities();

        assertThat(records).hasSize(2).allSatisfy(r -> {
            assertThat(Math.abs(r.getCoordinates().latitude() - 40.7128)).isLessThan(0.0101);
            assertThat(Math.abs(r.getCoordinates().longitude() + 74.0060)).isLessThan(0.0101);
            assertThat(r.getDistanceMeters()).isNotNull().isBetween(0.0, 2_000.0);
        });
    }

    @Test
    void shouldUseDefaultCoordinateWithoutFix() {
        RestaurantRecord r = extractor.extract("A French restaurant", Optional.empty()).entities().get(0);

        assertThat(r.getCoordinates()).isEqualTo(EntityExtractor.DEFAULT_COORDINATE);
        assertThat(r.getDistanceMeters()).isNull();
    }

    @Test
    void shouldFillFieldsWithinRanges() {
        RestaurantRecord r = extractor.extract("A Mediterranean restaurant", Optional.empty()).entities().get(0);

        assertThat(r.getId()).startsWith("rest_");
        assertThat(r.getRating()).isBetween(3.0, 5.0);
        assertThat(r.getPriceLevel()).isBetween(1, 4);
        assertThat(r.getAddress()).endsWith(" St");
        assertThat(r.getPhone()).startsWith("(555) ");
        assertThat(r.getWebsite()).isEqualTo("https://mediterraneanrestaurant.example.com");
        assertThat(r.getDescription()).startsWith("Authentic Mediterranean cuisine");
        assertThat(r.getHours()).hasSize(2);
    }

    @Test
    void shouldBeReproducibleWithSeededRandom() {
        String text = "A Chinese restaurant and an American diner";

        List<RestaurantRecord> first = new EntityExtractor(new Random(7)).extract(text, Optional.empty()).entities();
        List<RestaurantRecord> second = new EntityExtractor(new Random(7)).extract(text, Optional.empty()).entities();

        assertThat(first).extracting(RestaurantRecord::getId)
                .containsExactlyElementsOf(second.stream().map(RestaurantRecord::getId).toList());
        assertThat(first).extracting(RestaurantRecord::getName)
                .containsExactlyElementsOf(second.stream().map(RestaurantRecord::getName).toList());
    }

    @Test
    void shouldHandleBlankText() {
        ExtractionResult result = extractor.extract("   ", Optional.empty());

        assertThat(result.entities()).isEmpty();
        assertThat(result.passthroughText()).isEqualTo("   ");
    }
}
