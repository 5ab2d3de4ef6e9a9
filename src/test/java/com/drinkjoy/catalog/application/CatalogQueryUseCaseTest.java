package com.drinkjoy.catalog.application;

import com.drinkjoy.catalog.domain.model.CatalogItem;
import com.drinkjoy.catalog.domain.model.DrinkCategory;
import com.drinkjoy.catalog.domain.port.out.CatalogRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CatalogQueryUseCaseTest {

    @Mock
    private CatalogRepository catalogRepository;

    @InjectMocks
    private CatalogQueryUseCase useCase;

    @Test
    void shouldReturnItemsByCategory() {
        // Given
        List<CatalogItem> wines = List.of(CatalogItem.of("rioja", "Rioja", DrinkCategory.WINE));
        when(catalogRepository.getByCategory(DrinkCategory.WINE)).thenReturn(wines);

        // When
        List<CatalogItem> result = useCase.findByCategory(DrinkCategory.WINE);

        // Then
        assertThat(result).isEqualTo(wines);
    }

    @Test
    void shouldReturnEmptyListWhenRepositoryFails() {
        // Given
        when(catalogRepository.getAll()).thenThrow(new RuntimeException("Database error"));

        // When
        List<CatalogItem> result = useCase.findAll();

        // Then
        assertThat(result).isEmpty();
    }

    @Test
    void shouldNotQueryForBlankId() {
        // When
        Optional<CatalogItem> result = useCase.findById(" ");

        // Then
        assertThat(result).isEmpty();
        verifyNoInteractions(catalogRepository);
    }

    @Test
    void shouldReturnEmptyWhenLookupFails() {
        // Given
        when(catalogRepository.getById("ipa")).thenThrow(new RuntimeException("Database error"));

        // When & Then
        assertThat(useCase.findById("ipa")).isEmpty();
    }
}
