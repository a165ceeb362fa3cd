package com.dtoollookup.web;

import com.dtoollookup.admin.AdminMetadataStore;
import com.dtoollookup.admin.AdminService;
import com.dtoollookup.admin.BaseUriPermissions;
import com.dtoollookup.admin.DatasetAdminRecord;
import com.dtoollookup.admin.User;
import com.dtoollookup.admin.UserRegistration;
import com.dtoollookup.permission.PermissionEngine;
import com.dtoollookup.permission.PermissionUpdate;
import com.dtoollookup.permission.PermissionUpdateResult;
import com.dtoollookup.query.QueryEngine;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * User, base URI and permission administration. Every route requires an admin caller.
 */
@RestController
@RequestMapping("/admin")
public class AdminController {

    private final AdminService adminService;
    private final AdminMetadataStore adminStore;
    private final PermissionEngine permissions;
    private final QueryEngine queryEngine;
    private final UsernameResolver usernameResolver;

    public AdminController(
        AdminService adminService,
        AdminMetadataStore adminStore,
        PermissionEngine permissions,
        QueryEngine queryEngine,
        UsernameResolver usernameResolver
    ) {
        this.adminService = adminService;
        this.adminStore = adminStore;
        this.permissions = permissions;
        this.queryEngine = queryEngine;
        this.usernameResolver = usernameResolver;
    }

    public record BaseUriRegistration(@JsonProperty("base_uri") String baseUri) {}

    public record AdminFlag(@JsonProperty("is_admin") boolean admin) {}

    // -----------------------------------------------------------------------
    // Users
    // -----------------------------------------------------------------------

    @PostMapping("/user/register")
    public Map<String, List<String>> registerUsers(
        @RequestBody List<UserRegistration> users,
        HttpServletRequest request
    ) {
        requireAdmin(request);
        return Map.of("skipped_usernames", adminService.registerUsers(users));
    }

    @PutMapping("/user/{username}/is_admin")
    public User setUserIsAdmin(
        @PathVariable String username,
        @RequestBody AdminFlag flag,
        HttpServletRequest request
    ) {
        requireAdmin(request);
        if (!adminService.setUserIsAdmin(username, flag.admin())) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "User not registered: " + username);
        }
        return adminStore.getUser(username);
    }

    @GetMapping("/user/list")
    public List<User> listUsers(HttpServletRequest request) {
        requireAdmin(request);
        return adminService.listUsers();
    }

    @GetMapping("/user/{username}")
    public User userInfo(@PathVariable String username, HttpServletRequest request) {
        requireAdmin(request);
        return adminService.getUserInfo(username)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "User not registered: " + username));
    }

    // -----------------------------------------------------------------------
    // Base URIs
    // -----------------------------------------------------------------------

    @PostMapping("/base_uri/register")
    public Map<String, String> registerBaseUri(@RequestBody BaseUriRegistration body, HttpServletRequest request) {
        requireAdmin(request);
        return Map.of("base_uri", adminService.registerBaseUri(body.baseUri()));
    }

    @GetMapping("/base_uri/list")
    public List<String> listBaseUris(HttpServletRequest request) {
        requireAdmin(request);
        return adminService.listBaseUris();
    }

    @GetMapping("/base_uri/datasets")
    public List<DatasetAdminRecord> datasetsInBaseUri(
        @RequestParam("base_uri") String baseUri,
        HttpServletRequest request
    ) {
        requireAdmin(request);
        return queryEngine.listAdminMetadataInBaseUri(baseUri);
    }

    // -----------------------------------------------------------------------
    // Permissions
    // -----------------------------------------------------------------------

    @PostMapping("/permission/update_on_base_uri")
    public PermissionUpdateResult updatePermissions(@RequestBody PermissionUpdate update, HttpServletRequest request) {
        requireAdmin(request);
        return permissions.updatePermissions(update);
    }

    @GetMapping("/permission/info")
    public BaseUriPermissions permissionInfo(@RequestParam("base_uri") String baseUri, HttpServletRequest request) {
        requireAdmin(request);
        return permissions.showPermissions(baseUri);
    }

    private void requireAdmin(HttpServletRequest request) {
        var caller = adminStore.getUser(usernameResolver.resolve(request));
        if (!caller.admin()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, caller.username() + " is not an admin");
        }
    }
}
