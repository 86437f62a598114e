package com.hinata.backend.modules.rbac.presentation;

import java.util.List;

import com.hinata.backend.global.error.ConflictException;
import com.hinata.backend.global.error.NotFoundException;
import com.hinata.backend.modules.rbac.application.PermissionService;
import com.hinata.backend.modules.rbac.application.RoleService;
import com.hinata.backend.modules.rbac.presentation.dto.CreateRoleRequest;
import com.hinata.backend.modules.rbac.presentation.dto.PermissionResponse;
import com.hinata.backend.modules.rbac.presentation.dto.RoleResponse;
import com.hinata.backend.modules.rbac.presentation.dto.UpdateRoleRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/rbac/roles")
public class RoleController {

    private final RoleService roleService;
    private final PermissionService permissionService;

    public RoleController(RoleService roleService, PermissionService permissionService) {
        this.roleService = roleService;
        this.permissionService = permissionService;
    }

    @Operation(summary = "List roles")
    @GetMapping
    public ResponseEntity<List<RoleResponse>> listRoles() {
        return ResponseEntity.ok(roleService.listRoles());
    }

    @Operation(summary = "Create role", description = "The slug is derived from the name when omitted.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "Invalid scope, slug or parent role"),
            @ApiResponse(responseCode = "409", description = "Name or slug already taken")
    })
    @PostMapping
    public ResponseEntity<RoleResponse> createRole(@Valid @RequestBody CreateRoleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(roleService.createRole(request));
    }

    @GetMapping("/{roleId}")
    public ResponseEntity<RoleResponse> getRole(@PathVariable("roleId") Long roleId) {
        return ResponseEntity.ok(roleService.getRole(roleId));
    }

    @GetMapping("/by-name/{name}")
    public ResponseEntity<RoleResponse> getRoleByName(@PathVariable("name") String name) {
        return ResponseEntity.ok(roleService.getRoleByName(name));
    }

    @GetMapping("/by-slug/{slug}")
    public ResponseEntity<RoleResponse> getRoleBySlug(@PathVariable("slug") String slug) {
        return ResponseEntity.ok(roleService.getRoleBySlug(slug));
    }

    @Operation(summary = "Update role")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "400", description = "Inheritance would cross scopes or form a cycle"),
            @ApiResponse(responseCode = "404", description = "Role not found")
    })
    @PutMapping("/{roleId}")
    public ResponseEntity<RoleResponse> updateRole(
            @PathVariable("roleId") Long roleId,
            @Valid @RequestBody UpdateRoleRequest request
    ) {
        return ResponseEntity.ok(roleService.updateRole(roleId, request));
    }

    @Operation(summary = "Delete role")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deleted"),
            @ApiResponse(responseCode = "409", description = "Role is held by a member or inherited by another role")
    })
    @DeleteMapping("/{roleId}")
    public ResponseEntity<Void> deleteRole(@PathVariable("roleId") Long roleId) {
        roleService.deleteRole(roleId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{roleId}/permissions")
    public ResponseEntity<List<PermissionResponse>> listPermissions(@PathVariable("roleId") Long roleId) {
        return ResponseEntity.ok(roleService.listPermissionsOfRole(roleId));
    }

    @Operation(summary = "Grant permission to role")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Granted"),
            @ApiResponse(responseCode = "404", description = "Role or permission not found"),
            @ApiResponse(responseCode = "409", description = "Already granted")
    })
    @PostMapping("/{roleId}/permissions/{permissionId}")
    public ResponseEntity<Void> assignPermission(
            @PathVariable("roleId") Long roleId,
            @PathVariable("permissionId") Long permissionId
    ) {
        if (!permissionService.assignPermissionToRole(roleId, permissionId)) {
            throw new ConflictException("PERMISSION_ALREADY_ASSIGNED",
                    "Permission " + permissionId + " is already assigned to role " + roleId);
        }
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @Operation(summary = "Revoke permission from role")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Revoked"),
            @ApiResponse(responseCode = "404", description = "Permission was not granted")
    })
    @DeleteMapping("/{roleId}/permissions/{permissionId}")
    public ResponseEntity<Void> removePermission(
            @PathVariable("roleId") Long roleId,
            @PathVariable("permissionId") Long permissionId
    ) {
        if (!permissionService.removePermissionFromRole(roleId, permissionId)) {
            throw new NotFoundException("PERMISSION_NOT_ASSIGNED",
                    "Permission " + permissionId + " is not assigned to role " + roleId);
        }
        return ResponseEntity.noContent().build();
    }
}
