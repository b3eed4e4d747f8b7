package com.jdc.catalog_manager.domain.repository;

import com.jdc.catalog_manager.config.QuerydslConfig;
import com.jdc.catalog_manager.domain.entity.CatalogItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(QuerydslConfig.class)
@ActiveProfiles("test")
class CatalogItemRepositoryTest {

    @Autowired
    private CatalogItemRepository catalogItemRepository;

    private CatalogItem save(String name, LocalDateTime lastUsed) {
        return catalogItemRepository.save(CatalogItem.builder().name(name).lastUsed(lastUsed).build());
    }

    @Test
    @DisplayName("findByName is exact and case sensitive")
    void findByName_caseSensitive() {
        save("Jajka", null);

        assertThat(catalogItemRepository.findByName("Jajka")).isPresent();
        assertThat(catalogItemRepository.findByName("jajka")).isEmpty();
        assertThat(catalogItemRepository.findByName("Jajka ")).isEmpty();
    }

    @Test
    @DisplayName("the unique index rejects a second row with the same name")
    void uniqueName() {
        catalogItemRepository.saveAndFlush(CatalogItem.builder().name("Mleko").build());

        assertThatThrownBy(() -> catalogItemRepository.saveAndFlush(CatalogItem.builder().name("Mleko").build()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("names differing only in case are distinct rows")
    void caseVariantsCoexist() {
        catalogItemRepository.saveAndFlush(CatalogItem.builder().name("Jajka").build());
        catalogItemRepository.saveAndFlush(CatalogItem.builder().name("jajka").build());

        assertThat(catalogItemRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("names differing only in accents are distinct rows")
    void accentVariantsCoexist() {
        catalogItemRepository.saveAndFlush(CatalogItem.builder().name("Sól").build());
        catalogItemRepository.saveAndFlush(CatalogItem.builder().name("Sol").build());

        assertThat(catalogItemRepository.findByName("Sol")).get()
                .extracting(CatalogItem::getName).isEqualTo("Sol");
        assertThat(catalogItemRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("order is last_used descending with never used last, then name ascending")
    void ordering() {
        LocalDateTime t1 = LocalDateTime.of(2024, 1, 1, 10, 0);
        LocalDateTime t2 = LocalDateTime.of(2024, 2, 1, 10, 0);
        save("Cukier", null);
        save("Banan", t1);
        save("Agrest", t1);
        save("Ziemniak", t2);
        save("Awokado", null);

        List<String> names = catalogItemRepository.findAllOrdered().stream()
                .map(CatalogItem::getName)
                .toList();

        assertThat(names).containsExactly("Ziemniak", "Agrest", "Banan", "Awokado", "Cukier");
    }

    @Test
    @DisplayName("walking every page returns each item exactly once in list order")
    void exhaustivePaging() {
        LocalDateTime base = LocalDateTime.of(2024, 3, 1, 0, 0);
        for (int i = 0; i < 23; i++) {
            LocalDateTime lastUsed = i % 4 == 0 ? null : base.plusHours(i % 3);
            save(String.format("Item-%02d", i), lastUsed);
        }

        List<Long> expected = catalogItemRepository.findAllOrdered().stream()
                .map(CatalogItem::getId)
                .toList();

        int limit = 5;
        List<Long> walked = new ArrayList<>();
        for (long offset = 0; offset < 23; offset += limit) {
            catalogItemRepository.findPage(null, false, offset, limit)
                    .forEach(item -> walked.add(item.getId()));
        }

        Set<Long> unique = new HashSet<>(walked);
        assertThat(walked).hasSize(23);
        assertThat(unique).hasSize(23);
        assertThat(walked).containsExactlyElementsOf(expected);
        assertThat(catalogItemRepository.countByNameContains(null, false)).isEqualTo(23);
    }

    @Test
    @DisplayName("search is a contains match whose case handling is selectable")
    void searchContains() {
        save("Mleko kokosowe", null);
        save("Kokos wiórki", null);
        save("Mąka", null);

        assertThat(catalogItemRepository.findPage("kokos", false, 0, 20))
                .extracting(CatalogItem::getName)
                .containsExactlyInAnyOrder("Mleko kokosowe", "Kokos wiórki");
        assertThat(catalogItemRepository.findPage("kokos", true, 0, 20))
                .extracting(CatalogItem::getName)
                .containsExactly("Mleko kokosowe");
        assertThat(catalogItemRepository.countByNameContains("kokos", true)).isEqualTo(1);
    }
}
