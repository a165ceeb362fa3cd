package com.dtoollookup.admin;

import com.dtoollookup.TestStores;
import com.dtoollookup.errors.AuthenticationException;
import com.dtoollookup.errors.RegistrationConflictException;
import com.dtoollookup.errors.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dtoollookup.TestStores.EXAMPLE_UUID;
import static org.junit.jupiter.api.Assertions.*;

class AdminMetadataStoreTest {

    private AdminMetadataStore store;

    @BeforeEach
    void setUp() {
        store = TestStores.freshAdminStore();
    }

    // -----------------------------------------------------------------------
    // Users
    // -----------------------------------------------------------------------

    @Test
    void registerUsers_defaultsIsAdminToFalse() {
        store.registerUsers(List.of(
            new UserRegistration("magic.mirror", true),
            new UserRegistration("dopey", null)));

        assertTrue(store.getUser("magic.mirror").admin());
        assertFalse(store.getUser("dopey").admin());
    }

    @Test
    void registerUsers_skipsExistingUsernames() {
        store.registerUsers(List.of(new UserRegistration("sleepy", false)));

        var skipped = store.registerUsers(List.of(
            new UserRegistration("sleepy", true),
            new UserRegistration("sneezy", false)));

        assertEquals(List.of("sleepy"), skipped);
        assertFalse(store.getUser("sleepy").admin(), "Bulk registration must not change is_admin");
        assertEquals(2, store.listUsers().size());
    }

    @Test
    void getUser_unknownUser() {
        assertFalse(store.userExists("nobody"));
        assertThrows(AuthenticationException.class, () -> store.getUser("nobody"));
    }

    @Test
    void setUserIsAdmin_updatesExistingUserOnly() {
        store.registerUsers(List.of(new UserRegistration("doc", false)));

        assertTrue(store.setUserIsAdmin("doc", true));
        assertTrue(store.getUser("doc").admin());
        assertFalse(store.setUserIsAdmin("nobody", true));
    }

    // -----------------------------------------------------------------------
    // Base URIs
    // -----------------------------------------------------------------------

    @Test
    void getBaseUri_unregistered() {
        var e = assertThrows(ValidationException.class, () -> store.getBaseUri("s3://missing"));
        assertEquals("Base URI s3://missing not registered", e.getMessage());
    }

    @Test
    void registerBaseUri_storedAsGiven() {
        store.registerBaseUri("s3://bucket");

        assertTrue(store.baseUriExists("s3://bucket"));
        assertFalse(store.baseUriExists("s3://bucket/"), "The store does not normalize");
        assertThrows(ValidationException.class, () -> store.registerBaseUri("s3://bucket"));
    }

    // -----------------------------------------------------------------------
    // Admin records
    // -----------------------------------------------------------------------

    @Test
    void insertAdminRecord_readBackByUri() {
        store.registerBaseUri("s3://bucket");
        store.insertAdminRecord(EXAMPLE_UUID, "s3://bucket/abc", "s3://bucket", "abc");

        var record = store.getAdminRecordByUri("s3://bucket/abc").orElseThrow();
        assertEquals(new DatasetAdminRecord(EXAMPLE_UUID, "s3://bucket", "s3://bucket/abc", "abc"), record);
        assertTrue(store.getAdminRecordByUri("s3://bucket/other").isEmpty());
        assertEquals(1, store.countDatasets());
    }

    @Test
    void insertAdminRecord_duplicateUriIsConflict() {
        store.registerBaseUri("s3://bucket");
        store.insertAdminRecord(EXAMPLE_UUID, "s3://bucket/abc", "s3://bucket", "abc");

        assertThrows(RegistrationConflictException.class,
            () -> store.insertAdminRecord(EXAMPLE_UUID, "s3://bucket/abc", "s3://bucket", "abc"));
        assertEquals(1, store.countDatasets());
    }

    @Test
    void listDatasetsForBaseUri_onlyThatBaseUri() {
        store.registerBaseUri("s3://x");
        store.registerBaseUri("s3://y");
        store.insertAdminRecord(EXAMPLE_UUID, "s3://x/one", "s3://x", "one");
        store.insertAdminRecord(EXAMPLE_UUID, "s3://y/two", "s3://y", "two");

        var datasets = store.listDatasetsForBaseUri("s3://x");

        assertEquals(1, datasets.size());
        assertEquals("s3://x/one", datasets.get(0).uri());
    }

    // -----------------------------------------------------------------------
    // Permissions
    // -----------------------------------------------------------------------

    @Test
    void grantSearch_addsEdgeOnce() {
        store.registerUsers(List.of(new UserRegistration("grumpy", false)));
        store.registerBaseUri("s3://bucket");

        assertTrue(store.grantSearch("grumpy", "s3://bucket"));
        assertFalse(store.grantSearch("grumpy", "s3://bucket"), "Second grant is a no-op");

        assertTrue(store.hasSearchPermission("grumpy", "s3://bucket"));
        assertFalse(store.hasRegisterPermission("grumpy", "s3://bucket"), "Edges are independent");
        assertEquals(List.of("s3://bucket"), store.getUser("grumpy").searchBaseUris());
        assertEquals(List.of(), store.getUser("grumpy").registerBaseUris());
    }

    @Test
    void grant_unknownUserOrBaseUriIsNoOp() {
        store.registerUsers(List.of(new UserRegistration("grumpy", false)));
        store.registerBaseUri("s3://bucket");

        assertFalse(store.grantRegister("nobody", "s3://bucket"));
        assertFalse(store.grantRegister("grumpy", "s3://missing"));
        assertEquals(List.of(), store.usersWithRegisterPermission("s3://bucket"));
    }

    @Test
    void lookupVisibleDatasets_requiresSearchGrantOnOwningBaseUri() {
        store.registerUsers(List.of(new UserRegistration("happy", false)));
        store.registerBaseUri("s3://x");
        store.registerBaseUri("s3://y");
        store.grantSearch("happy", "s3://x");
        store.insertAdminRecord(EXAMPLE_UUID, "s3://y/abc", "s3://y", "abc");

        assertEquals(List.of(), store.lookupVisibleDatasets("happy", EXAMPLE_UUID));

        store.grantSearch("happy", "s3://y");
        assertEquals(1, store.lookupVisibleDatasets("happy", EXAMPLE_UUID).size());
    }

    @Test
    void lookupVisibleDatasets_sameUuidUnderSeveralUris() {
        store.registerUsers(List.of(new UserRegistration("happy", false)));
        store.registerBaseUri("s3://x");
        store.registerBaseUri("s3://y");
        store.grantSearch("happy", "s3://x");
        store.grantSearch("happy", "s3://y");
        store.insertAdminRecord(EXAMPLE_UUID, "s3://x/abc", "s3://x", "abc");
        store.insertAdminRecord(EXAMPLE_UUID, "s3://y/abc", "s3://y", "abc");

        var found = store.lookupVisibleDatasets("happy", EXAMPLE_UUID);

        assertEquals(List.of("s3://x/abc", "s3://y/abc"), found.stream().map(DatasetAdminRecord::uri).toList());
    }
}
