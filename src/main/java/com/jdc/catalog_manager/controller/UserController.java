package com.jdc.catalog_manager.controller;

import com.jdc.catalog_manager.domain.dto.common.PageResponseDto;
import com.jdc.catalog_manager.domain.dto.user.TokenResponseDto;
import com.jdc.catalog_manager.domain.dto.user.UserLoginRequestDto;
import com.jdc.catalog_manager.domain.dto.user.UserPasswordChangeRequestDto;
import com.jdc.catalog_manager.domain.dto.user.UserRegisterRequestDto;
import com.jdc.catalog_manager.domain.dto.user.UserResponseDto;
import com.jdc.catalog_manager.domain.dto.user.UserUpdateRequestDto;
import com.jdc.catalog_manager.security.CustomUserDetails;
import com.jdc.catalog_manager.service.UserService;
import com.jdc.catalog_manager.util.PageWindowResolver;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
@Tag(name = "Users", description = "Registration, login and account management")
public class UserController {

    private static final String PATH = "/api/v1/users";

    private final UserService userService;
    private final PageWindowResolver pageWindowResolver;

    @PostMapping
    @Operation(summary = "Register a user")
    public ResponseEntity<UserResponseDto> register(@RequestBody @Valid UserRegisterRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.register(dto));
    }

    @PostMapping("/login")
    @Operation(summary = "Log in and receive a bearer token")
    public ResponseEntity<TokenResponseDto> login(@RequestBody @Valid UserLoginRequestDto dto) {
        return ResponseEntity.ok(userService.login(dto));
    }

    @PostMapping("/change-password")
    @Operation(summary = "Change the current user's password")
    public ResponseEntity<Void> changePassword(
            @RequestBody @Valid UserPasswordChangeRequestDto dto,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        userService.changePassword(userDetails.getUserId(), dto);
        return ResponseEntity.noContent().build();
    }

    @GetMapping
    @Operation(summary = "List users (admin only)")
    public ResponseEntity<PageResponseDto<UserResponseDto>> list(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        var slice = userService.list(userDetails.getUserId(), pageWindowResolver.resolve(limit, offset));
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH, Map.of()));
    }

    @GetMapping("/public")
    @Operation(summary = "All users without paging")
    public ResponseEntity<List<UserResponseDto>> listPublic() {
        return ResponseEntity.ok(userService.listPublic());
    }

    @GetMapping("/me")
    @Operation(summary = "Current user")
    public ResponseEntity<UserResponseDto> me(@AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(userService.getUser(userDetails.getUserId()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a user")
    public ResponseEntity<UserResponseDto> get(@PathVariable Long id) {
        return ResponseEntity.ok(userService.getUser(id));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a user (self or admin)")
    public ResponseEntity<UserResponseDto> update(
            @PathVariable Long id,
            @RequestBody @Valid UserUpdateRequestDto dto,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(userService.update(userDetails.getUserId(), id, dto));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a user and their recipes (self or admin)")
    public ResponseEntity<Void> delete(
            @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        userService.delete(userDetails.getUserId(), id);
        return ResponseEntity.noContent().build();
    }
}
