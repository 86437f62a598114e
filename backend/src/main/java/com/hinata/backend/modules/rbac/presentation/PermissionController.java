package com.hinata.backend.modules.rbac.presentation;

import java.util.List;

import com.hinata.backend.modules.rbac.application.PermissionService;
import com.hinata.backend.modules.rbac.presentation.dto.CreatePermissionRequest;
import com.hinata.backend.modules.rbac.presentation.dto.PermissionResponse;
import com.hinata.backend.modules.rbac.presentation.dto.UpdatePermissionRequest;

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
@RequestMapping("/rbac/permissions")
public class PermissionController {

    private final PermissionService permissionService;

    public PermissionController(PermissionService permissionService) {
        this.permissionService = permissionService;
    }

    @GetMapping
    public ResponseEntity<List<PermissionResponse>> listPermissions() {
        return ResponseEntity.ok(permissionService.listPermissions());
    }

    @Operation(summary = "Create permission", description = "Name format: resource[:action]:METHOD[,METHOD...] or super_admin.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "Name does not follow the permission format"),
            @ApiResponse(responseCode = "409", description = "Name or slug already taken")
    })
    @PostMapping
    public ResponseEntity<PermissionResponse> createPermission(@Valid @RequestBody CreatePermissionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(permissionService.createPermission(request));
    }

    @GetMapping("/{permissionId}")
    public ResponseEntity<PermissionResponse> getPermission(@PathVariable("permissionId") Long permissionId) {
        return ResponseEntity.ok(permissionService.getPermission(permissionId));
    }

    @GetMapping("/by-name/{name}")
    public ResponseEntity<PermissionResponse> getPermissionByName(@PathVariable("name") String name) {
        return ResponseEntity.ok(permissionService.getPermissionByName(name));
    }

    @PutMapping("/{permissionId}")
    public ResponseEntity<PermissionResponse> updatePermission(
            @PathVariable("permissionId") Long permissionId,
            @Valid @RequestBody UpdatePermissionRequest request
    ) {
        return ResponseEntity.ok(permissionService.updatePermission(permissionId, request));
    }

    @Operation(summary = "Delete permission")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deleted"),
            @ApiResponse(responseCode = "409", description = "Still granted to a role")
    })
    @DeleteMapping("/{permissionId}")
    public ResponseEntity<Void> deletePermission(@PathVariable("permissionId") Long permissionId) {
        permissionService.deletePermission(permissionId);
        return ResponseEntity.noContent().build();
    }
}
