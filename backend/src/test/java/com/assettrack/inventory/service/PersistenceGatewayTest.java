package com.assettrack.inventory.service;

import com.assettrack.inventory.importer.AssetCandidate;
import com.assettrack.inventory.importer.AssignmentCandidate;
import com.assettrack.inventory.importer.Coerced;
import com.assettrack.inventory.importer.UserCandidate;
import com.assettrack.inventory.importer.ValueCoercion;
import com.assettrack.inventory.model.AppUser;
import com.assettrack.inventory.model.Asset;
import com.assettrack.inventory.model.AssetAssignment;
import com.assettrack.inventory.model.AssetCategory;
import com.assettrack.inventory.model.AssetCondition;
import com.assettrack.inventory.model.AssetStatus;
import com.assettrack.inventory.model.AssignmentStatus;
import com.assettrack.inventory.model.UserRole;
import com.assettrack.inventory.repository.AppUserRepository;
import com.assettrack.inventory.repository.AssetAssignmentRepository;
import com.assettrack.inventory.repository.AssetRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PersistenceGatewayTest {

    @Mock private AssetRepository assetRepository;
    @Mock private AppUserRepository userRepository;
    @Mock private AssetAssignmentRepository assignmentRepository;

    private static AssetCandidate laptop(String serial) {
        return new AssetCandidate("A-1", "Laptop", "laptop", null, serial, "X1", "Lenovo",
                ValueCoercion.toDate("2024-02-01"), "1200.50", null, "available", "fair",
                "HQ", null, null, null, null, null);
    }

    @Test
    void asset_storesTypedValuesAndCreator() {
        AssetPersistenceGateway gateway = new AssetPersistenceGateway(assetRepository);
        when(assetRepository.existsByAssetTag("A-1")).thenReturn(false);
        when(assetRepository.existsBySerialNumber("SN-1")).thenReturn(false);

        gateway.insert(laptop("SN-1"), "alice");

        ArgumentCaptor<Asset> captor = ArgumentCaptor.forClass(Asset.class);
        verify(assetRepository).save(captor.capture());
        Asset saved = captor.getValue();
        assertThat(saved.getCategory()).isEqualTo(AssetCategory.LAPTOP);
        assertThat(saved.getCondition()).isEqualTo(AssetCondition.FAIR);
        assertThat(saved.getStatus()).isEqualTo(AssetStatus.AVAILABLE);
        assertThat(saved.getPurchaseDate()).isEqualTo(LocalDate.of(2024, 2, 1));
        assertThat(saved.getPurchasePrice()).isEqualByComparingTo(new BigDecimal("1200.50"));
        assertThat(saved.getCurrentValue()).isNull();
        assertThat(saved.getCreatedBy()).isEqualTo("alice");
        assertThat(saved.getCreatedAt()).isNotNull();
    }

    @Test
    void asset_duplicateTagOrSerialIsRejected() {
        AssetPersistenceGateway gateway = new AssetPersistenceGateway(assetRepository);
        when(assetRepository.existsByAssetTag("A-1")).thenReturn(true, false);
        when(assetRepository.existsBySerialNumber("SN-1")).thenReturn(true);

        assertThatThrownBy(() -> gateway.insert(laptop("SN-1"), "alice"))
                .isInstanceOf(RecordPersistenceException.class)
                .hasMessage("Asset tag already exists");
        assertThatThrownBy(() -> gateway.insert(laptop("SN-1"), "alice"))
                .hasMessage("Serial number already exists");
        verify(assetRepository, never()).save(any());
    }

    @Test
    void user_emailIsLowerCasedBeforeUniquenessCheck() {
        UserPersistenceGateway gateway = new UserPersistenceGateway(userRepository);
        UserCandidate candidate = new UserCandidate("import-1", "Jane", "Jane.Doe@Example.COM", "IT", null, "E-7", null, "manager", true);
        when(userRepository.existsByEmail("jane.doe@example.com")).thenReturn(false);
        when(userRepository.existsByEmployeeId("E-7")).thenReturn(false);

        gateway.insert(candidate, "alice");

        ArgumentCaptor<AppUser> captor = ArgumentCaptor.forClass(AppUser.class);
        verify(userRepository).save(captor.capture());
        assertThat(captor.getValue().getEmail()).isEqualTo("jane.doe@example.com");
        assertThat(captor.getValue().getId()).isEqualTo("import-1");
        assertThat(captor.getValue().getRole()).isEqualTo(UserRole.MANAGER);
        assertThat(captor.getValue().isActive()).isTrue();
    }

    @Test
    void user_duplicatesAreRejected() {
        UserPersistenceGateway gateway = new UserPersistenceGateway(userRepository);
        UserCandidate candidate = new UserCandidate("import-1", "Jane", "jane@example.com", null, null, "E-7", null, "user", false);
        when(userRepository.existsByEmail("jane@example.com")).thenReturn(true, false);
        when(userRepository.existsByEmployeeId("E-7")).thenReturn(true);

        assertThatThrownBy(() -> gateway.insert(candidate, "alice")).hasMessage("Email already exists");
        assertThatThrownBy(() -> gateway.insert(candidate, "alice")).hasMessage("Employee ID already exists");
    }

    @Test
    void assignment_activatesAndMarksAssetAssigned() {
        AssignmentPersistenceGateway gateway = new AssignmentPersistenceGateway(assetRepository, userRepository, assignmentRepository);
        Asset asset = new Asset("A-1", "Laptop", AssetCategory.LAPTOP);
        asset.setId(5L);
        AppUser user = new AppUser("import-1", "Jane", "jane@example.com");
        when(assetRepository.findById(5L)).thenReturn(Optional.of(asset));
        when(userRepository.findById("import-1")).thenReturn(Optional.of(user));

        gateway.insert(new AssignmentCandidate(5, "import-1", "Travel", ValueCoercion.toDateTime("2024-07-01"), null), "alice");

        ArgumentCaptor<AssetAssignment> captor = ArgumentCaptor.forClass(AssetAssignment.class);
        verify(assignmentRepository).save(captor.capture());
        AssetAssignment saved = captor.getValue();
        assertThat(saved.getStatus()).isEqualTo(AssignmentStatus.ACTIVE);
        assertThat(saved.isActive()).isTrue();
        assertThat(saved.getAssignedBy()).isEqualTo("alice");
        assertThat(saved.getExpectedReturnAt()).isEqualTo(LocalDateTime.of(2024, 7, 1, 0, 0));
        assertThat(asset.getStatus()).isEqualTo(AssetStatus.ASSIGNED);
        verify(assetRepository).save(asset);
    }

    @Test
    void assignment_referencesMustExistAndAssetBeAvailable() {
        AssignmentPersistenceGateway gateway = new AssignmentPersistenceGateway(assetRepository, userRepository, assignmentRepository);
        Asset busy = new Asset("A-2", "Monitor", AssetCategory.MONITOR);
        busy.setStatus(AssetStatus.MAINTENANCE);
        when(assetRepository.findById(1L)).thenReturn(Optional.empty());
        when(assetRepository.findById(2L)).thenReturn(Optional.of(busy));
        when(userRepository.findById("ghost")).thenReturn(Optional.empty());
        when(userRepository.findById("import-1")).thenReturn(Optional.of(new AppUser("import-1", "Jane", "jane@example.com")));

        assertThatThrownBy(() -> gateway.insert(new AssignmentCandidate(1, "import-1", null, Coerced.missing(), null), "alice"))
                .hasMessage("Asset with id 1 not found");
        assertThatThrownBy(() -> gateway.insert(new AssignmentCandidate(2, "ghost", null, Coerced.missing(), null), "alice"))
                .hasMessage("User with id ghost not found");
        assertThatThrownBy(() -> gateway.insert(new AssignmentCandidate(2, "import-1", null, Coerced.missing(), null), "alice"))
                .hasMessage("Asset A-2 is not available");
        verifyNoInteractions(assignmentRepository);
    }
}
