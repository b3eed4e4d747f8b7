package com.jdc.catalog_manager.service;

import com.jdc.catalog_manager.domain.dto.user.TokenResponseDto;
import com.jdc.catalog_manager.domain.dto.user.UserLoginRequestDto;
import com.jdc.catalog_manager.domain.dto.user.UserPasswordChangeRequestDto;
import com.jdc.catalog_manager.domain.dto.user.UserRegisterRequestDto;
import com.jdc.catalog_manager.domain.dto.user.UserResponseDto;
import com.jdc.catalog_manager.domain.dto.user.UserUpdateRequestDto;
import com.jdc.catalog_manager.domain.entity.User;
import com.jdc.catalog_manager.domain.repository.RecipeItemRepository;
import com.jdc.catalog_manager.domain.repository.RecipeRepository;
import com.jdc.catalog_manager.domain.repository.UserRepository;
import com.jdc.catalog_manager.domain.type.Role;
import com.jdc.catalog_manager.exception.CustomException;
import com.jdc.catalog_manager.exception.ErrorCode;
import com.jdc.catalog_manager.jwt.JwtTokenProvider;
import com.jdc.catalog_manager.util.PageWindow;
import com.querydsl.jpa.impl.JPAQueryFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private RecipeRepository recipeRepository;

    @Mock
    private RecipeItemRepository recipeItemRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private JPAQueryFactory queryFactory;

    @Mock
    private JwtTokenProvider jwtTokenProvider;

    @InjectMocks
    private UserService userService;

    @Test
    @DisplayName("register: stores a lower-cased email and a hashed password")
    void register_hashesPassword() {
        when(userRepository.existsByEmail("cook@example.com")).thenReturn(false);
        when(passwordEncoder.encode("secret-password")).thenReturn("bcrypt-hash");
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> invocation.getArgument(0));

        UserResponseDto response = userService.register(
                new UserRegisterRequestDto(" Cook@Example.com ", "secret-password"));

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(captor.capture());
        assertEquals("cook@example.com", captor.getValue().getEmail());
        assertEquals("bcrypt-hash", captor.getValue().getPasswordHash());
        assertEquals("cook@example.com", response.getEmail());
    }

    @Test
    @DisplayName("register: an email that is taken is DUPLICATE_EMAIL")
    void register_duplicate() {
        when(userRepository.existsByEmail("cook@example.com")).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class,
                () -> userService.register(new UserRegisterRequestDto("cook@example.com", "secret-password")));

        assertEquals(ErrorCode.DUPLICATE_EMAIL, ex.getErrorCode());
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("login: a wrong password is INVALID_CREDENTIALS")
    void login_wrongPassword() {
        User user = User.builder().id(1L).email("cook@example.com").passwordHash("hash").build();
        when(userRepository.findByEmail("cook@example.com")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("nope", "hash")).thenReturn(false);

        CustomException ex = assertThrows(CustomException.class,
                () -> userService.login(new UserLoginRequestDto("cook@example.com", "nope")));

        assertEquals(ErrorCode.INVALID_CREDENTIALS, ex.getErrorCode());
        verifyNoInteractions(jwtTokenProvider);
    }

    @Test
    @DisplayName("login: valid credentials return a bearer token")
    void login_success() {
        User user = User.builder().id(1L).email("cook@example.com").passwordHash("hash").build();
        when(userRepository.findByEmail("cook@example.com")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("secret-password", "hash")).thenReturn(true);
        when(jwtTokenProvider.createAccessToken(user)).thenReturn("jwt-token");

        TokenResponseDto token = userService.login(new UserLoginRequestDto("cook@example.com", "secret-password"));

        assertEquals("jwt-token", token.accessToken());
        assertEquals("bearer", token.tokenType());
        assertEquals(1L, token.user().getId());
    }

    private static User user(Long id, String email, Role role) {
        return User.builder().id(id).email(email).passwordHash("hash").role(role).build();
    }

    @Test
    @DisplayName("changePassword: re-hashes the new password after checking the current one")
    void changePassword_success() {
        User cook = user(1L, "cook@example.com", Role.USER);
        when(userRepository.findById(1L)).thenReturn(Optional.of(cook));
        when(passwordEncoder.matches("old-password", "hash")).thenReturn(true);
        when(passwordEncoder.encode("new-password")).thenReturn("new-hash");

        userService.changePassword(1L, new UserPasswordChangeRequestDto("old-password", "new-password"));

        assertEquals("new-hash", cook.getPasswordHash());
    }

    @Test
    @DisplayName("changePassword: a wrong current password is INVALID_CURRENT_PASSWORD")
    void changePassword_wrongCurrent() {
        User cook = user(1L, "cook@example.com", Role.USER);
        when(userRepository.findById(1L)).thenReturn(Optional.of(cook));
        when(passwordEncoder.matches("guess", "hash")).thenReturn(false);

        CustomException ex = assertThrows(CustomException.class,
                () -> userService.changePassword(1L, new UserPasswordChangeRequestDto("guess", "new-password")));

        assertEquals(ErrorCode.INVALID_CURRENT_PASSWORD, ex.getErrorCode());
        assertEquals("hash", cook.getPasswordHash());
        verify(passwordEncoder, never()).encode(any());
    }

    @Test
    @DisplayName("update: a user changes their own email, normalized")
    void update_ownEmail() {
        User cook = user(1L, "cook@example.com", Role.USER);
        when(userRepository.findById(1L)).thenReturn(Optional.of(cook));
        when(userRepository.existsByEmailAndIdNot("chef@example.com", 1L)).thenReturn(false);

        UserResponseDto response = userService.update(1L, 1L, new UserUpdateRequestDto(" Chef@Example.com", null));

        assertEquals("chef@example.com", response.getEmail());
        assertEquals("chef@example.com", cook.getEmail());
    }

    @Test
    @DisplayName("update: a taken email is DUPLICATE_EMAIL")
    void update_duplicateEmail() {
        when(userRepository.findById(1L)).thenReturn(Optional.of(user(1L, "cook@example.com", Role.USER)));
        when(userRepository.existsByEmailAndIdNot("chef@example.com", 1L)).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class,
                () -> userService.update(1L, 1L, new UserUpdateRequestDto("chef@example.com", null)));

        assertEquals(ErrorCode.DUPLICATE_EMAIL, ex.getErrorCode());
    }

    @Test
    @DisplayName("update: another user's account is USER_ACCESS_DENIED for a non-admin")
    void update_otherUserDenied() {
        User stranger = user(2L, "stranger@example.com", Role.USER);
        when(userRepository.findById(1L)).thenReturn(Optional.of(user(1L, "cook@example.com", Role.USER)));
        when(userRepository.findById(2L)).thenReturn(Optional.of(stranger));

        CustomException ex = assertThrows(CustomException.class,
                () -> userService.update(1L, 2L, new UserUpdateRequestDto("mine@example.com", null)));

        assertEquals(ErrorCode.USER_ACCESS_DENIED, ex.getErrorCode());
        assertEquals("stranger@example.com", stranger.getEmail());
    }

    @Test
    @DisplayName("update: a user cannot promote themselves")
    void update_selfPromotionDenied() {
        User cook = user(1L, "cook@example.com", Role.USER);
        when(userRepository.findById(1L)).thenReturn(Optional.of(cook));

        CustomException ex = assertThrows(CustomException.class,
                () -> userService.update(1L, 1L, new UserUpdateRequestDto(null, Role.ADMIN)));

        assertEquals(ErrorCode.USER_ACCESS_DENIED, ex.getErrorCode());
        assertEquals(Role.USER, cook.getRole());
    }

    @Test
    @DisplayName("update: an admin may change another user's role")
    void update_adminChangesRole() {
        User cook = user(2L, "cook@example.com", Role.USER);
        when(userRepository.findById(1L)).thenReturn(Optional.of(user(1L, "admin@example.com", Role.ADMIN)));
        when(userRepository.findById(2L)).thenReturn(Optional.of(cook));

        UserResponseDto response = userService.update(1L, 2L, new UserUpdateRequestDto(null, Role.ADMIN));

        assertEquals(Role.ADMIN, response.getRole());
    }

    @Test
    @DisplayName("delete: removes links, then recipes, then the account")
    void delete_ownAccount() {
        when(userRepository.findById(1L)).thenReturn(Optional.of(user(1L, "cook@example.com", Role.USER)));
        when(userRepository.existsById(1L)).thenReturn(true);

        userService.delete(1L, 1L);

        InOrder inOrder = inOrder(recipeItemRepository, recipeRepository, userRepository);
        inOrder.verify(recipeItemRepository).deleteByRecipeUserId(1L);
        inOrder.verify(recipeRepository).deleteByUserId(1L);
        inOrder.verify(userRepository).deleteById(1L);
    }

    @Test
    @DisplayName("delete: another user's account is USER_ACCESS_DENIED for a non-admin")
    void delete_otherUserDenied() {
        when(userRepository.findById(1L)).thenReturn(Optional.of(user(1L, "cook@example.com", Role.USER)));

        CustomException ex = assertThrows(CustomException.class, () -> userService.delete(1L, 2L));

        assertEquals(ErrorCode.USER_ACCESS_DENIED, ex.getErrorCode());
        verifyNoInteractions(recipeItemRepository, recipeRepository);
        verify(userRepository, never()).deleteById(any());
    }

    @Test
    @DisplayName("delete: an admin deleting a missing user gets USER_NOT_FOUND")
    void delete_missingUser() {
        when(userRepository.findById(1L)).thenReturn(Optional.of(user(1L, "admin@example.com", Role.ADMIN)));
        when(userRepository.existsById(9L)).thenReturn(false);

        CustomException ex = assertThrows(CustomException.class, () -> userService.delete(1L, 9L));

        assertEquals(ErrorCode.USER_NOT_FOUND, ex.getErrorCode());
        verifyNoInteractions(recipeItemRepository, recipeRepository);
    }

    @Test
    @DisplayName("list: only admins may page through users")
    void list_requiresAdmin() {
        when(userRepository.findById(1L)).thenReturn(Optional.of(user(1L, "cook@example.com", Role.USER)));

        CustomException ex = assertThrows(CustomException.class, () -> userService.list(1L, new PageWindow(0, 20)));

        assertEquals(ErrorCode.USER_ACCESS_DENIED, ex.getErrorCode());
        verifyNoInteractions(queryFactory);
    }
}
