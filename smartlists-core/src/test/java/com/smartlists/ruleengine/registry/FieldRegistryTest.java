package com.smartlists.ruleengine.registry;

import com.smartlists.ruleengine.api.model.PersonCredit;
import com.smartlists.ruleengine.runtime.model.ExtractionGroup;
import com.smartlists.ruleengine.runtime.model.FieldCategory;
import com.smartlists.ruleengine.runtime.model.FieldMetadata;
import com.smartlists.ruleengine.runtime.model.FieldValueType;
import com.smartlists.ruleengine.runtime.model.Operator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FieldRegistryTest {

    private final FieldRegistry registry = FieldRegistry.standard();

    @Test
    @DisplayName("Lookups are case-insensitive")
    void shouldLookupCaseInsensitively() {
        assertThat(registry.lookup("genres")).isPresent();
        assertThat(registry.lookup("GENRES").get().name()).isEqualTo("Genres");
        assertThat(registry.lookup("NoSuchField")).isEmpty();
        assertThat(registry.lookup(null)).isEmpty();
    }

    @Test
    @DisplayName("Every field has a unique name and at least one operator")
    void shouldHaveUniqueNamesAndOperators() {
        Set<String> names = new HashSet<>();
        for (FieldMetadata field : registry.allFields()) {
            assertThat(names.add(field.name().toLowerCase(Locale.ROOT)))
                    .as("duplicate %s", field.name()).isTrue();
            assertThat(field.allowedOperators()).isNotEmpty();
        }
        assertThat(registry.size()).isEqualTo(names.size());
    }

    @Test
    @DisplayName("Direct properties and cheap groups are not expensive")
    void shouldClassifyCheapFields() {
        assertThat(registry.isExpensive("Name")).isFalse();
        assertThat(registry.isExpensive("CommunityRating")).isFalse();
        assertThat(registry.isExpensive("Genres")).isFalse();
        assertThat(registry.isExpensive("PlaybackStatus")).isFalse();
        assertThat(registry.isExpensive("FileName")).isFalse();
        assertThat(registry.isExpensive("LibraryName")).isFalse();
    }

    @Test
    @DisplayName("Lookup-backed fields are expensive")
    void shouldClassifyExpensiveFields() {
        assertThat(registry.isExpensive("Actors")).isTrue();
        assertThat(registry.isExpensive("Collections")).isTrue();
        assertThat(registry.isExpensive("Resolution")).isTrue();
        assertThat(registry.isExpensive("SeriesName")).isTrue();
        assertThat(registry.isExpensive("ExternalList")).isTrue();
        assertThat(registry.isExpensive("NextUnwatched")).isTrue();
        assertThat(registry.extractionGroupOf("AudioLanguages")).isEqualTo(ExtractionGroup.AUDIO_LANGUAGES.bit());
    }

    @Test
    @DisplayName("Operator sets follow the value type")
    void shouldExposeOperatorSets() {
        assertThat(registry.operatorsFor("Name")).containsExactlyElementsOf(FieldRegistry.STRING_OPERATORS);
        assertThat(registry.operatorsFor("Tags")).doesNotContain(Operator.EQUAL);
        assertThat(registry.operatorsFor("ReleaseDate")).contains(Operator.NEWER_THAN, Operator.WEEKDAY);
        assertThat(registry.operatorsFor("SimilarTo"))
                .containsExactly(Operator.EQUAL, Operator.CONTAINS, Operator.IS_IN, Operator.MATCH_REGEX);
        assertThat(registry.operatorsFor("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Person fields are list fields served by the people lookup")
    void shouldRegisterPersonFields() {
        List<FieldMetadata> people = registry.fieldsInGroup(ExtractionGroup.PEOPLE);
        assertThat(people).hasSize(PersonRole.values().length);
        assertThat(people).allMatch(FieldMetadata::personField)
                .allMatch(f -> f.valueType() == FieldValueType.LIST);
        assertThat(registry.fieldsByCategory().get(FieldCategory.PEOPLE_SUB_FIELDS)).hasSize(people.size());
    }

    @Test
    @DisplayName("User specific fields are flagged")
    void shouldFlagUserSpecificFields() {
        assertThat(registry.lookup("IsFavorite").get().userSpecific()).isTrue();
        assertThat(registry.lookup("PlayCount").get().userSpecific()).isTrue();
        assertThat(registry.lookup("Name").get().userSpecific()).isFalse();
    }

    @Test
    @DisplayName("Person roles select credits by type")
    void shouldSelectCreditsByRole() {
        List<PersonCredit> credits = List.of(
                new PersonCredit("Keanu Reeves", "Actor", "Neo"),
                new PersonCredit("Lana Wachowski", "Director", null),
                new PersonCredit("Someone", "Guest Star", "Cameo"));

        assertThat(PersonRole.ACTORS.select(credits)).containsExactly("Keanu Reeves");
        assertThat(PersonRole.ACTOR_ROLES.select(credits)).containsExactly("Neo");
        assertThat(PersonRole.GUEST_STARS.select(credits)).containsExactly("Someone");
        assertThat(PersonRole.PEOPLE.select(credits)).hasSize(3);
        assertThat(PersonRole.forField("directors")).isEqualTo(PersonRole.DIRECTORS);
    }
}
