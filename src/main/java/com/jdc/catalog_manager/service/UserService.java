package com.jdc.catalog_manager.service;

import com.jdc.catalog_manager.domain.dto.user.TokenResponseDto;
import com.jdc.catalog_manager.domain.dto.user.UserLoginRequestDto;
import com.jdc.catalog_manager.domain.dto.user.UserPasswordChangeRequestDto;
import com.jdc.catalog_manager.domain.dto.user.UserRegisterRequestDto;
import com.jdc.catalog_manager.domain.dto.user.UserResponseDto;
import com.jdc.catalog_manager.domain.dto.user.UserUpdateRequestDto;
import com.jdc.catalog_manager.domain.entity.QUser;
import com.jdc.catalog_manager.domain.entity.User;
import com.jdc.catalog_manager.domain.repository.RecipeItemRepository;
import com.jdc.catalog_manager.domain.repository.RecipeRepository;
import com.jdc.catalog_manager.domain.repository.UserRepository;
import com.jdc.catalog_manager.exception.CustomException;
import com.jdc.catalog_manager.exception.ErrorCode;
import com.jdc.catalog_manager.jwt.JwtTokenProvider;
import com.jdc.catalog_manager.mapper.UserMapper;
import com.jdc.catalog_manager.util.PageSlice;
import com.jdc.catalog_manager.util.PageWindow;
import com.querydsl.jpa.impl.JPAQueryFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final RecipeRepository recipeRepository;
    private final RecipeItemRepository recipeItemRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;
    private final JPAQueryFactory queryFactory;

    @Transactional
    public UserResponseDto register(UserRegisterRequestDto dto) {
        String email = normalizeEmail(dto.getEmail());
        if (userRepository.existsByEmail(email)) {
            throw new CustomException(ErrorCode.DUPLICATE_EMAIL);
        }
        User user = userRepository.save(UserMapper.toEntity(email, passwordEncoder.encode(dto.getPassword())));
        log.info("User registered: id={}", user.getId());
        return UserMapper.toDto(user);
    }

    @Transactional(readOnly = true)
    public TokenResponseDto login(UserLoginRequestDto dto) {
        User user = userRepository.findByEmail(normalizeEmail(dto.getEmail()))
                .filter(u -> passwordEncoder.matches(dto.getPassword(), u.getPasswordHash()))
                .orElseThrow(() -> new CustomException(ErrorCode.INVALID_CREDENTIALS));
        return TokenResponseDto.bearer(jwtTokenProvider.createAccessToken(user), UserMapper.toDto(user));
    }

    @Transactional(readOnly = true)
    public UserResponseDto getUser(Long userId) {
        return UserMapper.toDto(getEntity(userId));
    }

    /**
     * Paged user list for administrators.
     */
    @Transactional(readOnly = true)
    public PageSlice<UserResponseDto> list(Long requesterId, PageWindow window) {
        if (!getEntity(requesterId).isAdmin()) {
            throw new CustomException(ErrorCode.USER_ACCESS_DENIED, "Listing users requires the ADMIN role");
        }
        QUser user = QUser.user;

        List<User> content = queryFactory
                .selectFrom(user)
                .orderBy(user.createdAt.desc(), user.id.desc())
                .offset(window.offset())
                .limit(window.limit())
                .fetch();

        Long total = queryFactory
                .select(user.count())
                .from(user)
                .fetchOne();

        return new PageSlice<>(content, total != null ? total : 0L, window).map(UserMapper::toDto);
    }

    @Transactional(readOnly = true)
    public List<UserResponseDto> listPublic() {
        return userRepository.findAllByOrderByCreatedAtDescIdDesc().stream()
                .map(UserMapper::toDto)
                .toList();
    }

    @Transactional
    public UserResponseDto update(Long requesterId, Long userId, UserUpdateRequestDto dto) {
        User requester = getEntity(requesterId);
        User target = requesterId.equals(userId) ? requester : getEntity(userId);
        if (!requester.getId().equals(target.getId()) && !requester.isAdmin()) {
            throw new CustomException(ErrorCode.USER_ACCESS_DENIED);
        }

        if (dto.getEmail() != null) {
            String email = normalizeEmail(dto.getEmail());
            if (userRepository.existsByEmailAndIdNot(email, userId)) {
                throw new CustomException(ErrorCode.DUPLICATE_EMAIL);
            }
            target.changeEmail(email);
        }
        if (dto.getRole() != null && dto.getRole() != target.getRole()) {
            if (!requester.isAdmin()) {
                throw new CustomException(ErrorCode.USER_ACCESS_DENIED, "Changing a role requires the ADMIN role");
            }
            target.changeRole(dto.getRole());
        }
        log.info("User updated: id={}, by={}", userId, requesterId);
        return UserMapper.toDto(target);
    }

    /**
     * Deletes an account together with its recipes and their ingredient links.
     * Catalog items stay, they are shared by every user.
     */
    @Transactional
    public void delete(Long requesterId, Long userId) {
        User requester = getEntity(requesterId);
        if (!requesterId.equals(userId) && !requester.isAdmin()) {
            throw new CustomException(ErrorCode.USER_ACCESS_DENIED);
        }
        if (!userRepository.existsById(userId)) {
            throw new CustomException(ErrorCode.USER_NOT_FOUND);
        }
        int links = recipeItemRepository.deleteByRecipeUserId(userId);
        int recipes = recipeRepository.deleteByUserId(userId);
        userRepository.deleteById(userId);
        log.info("User deleted: id={}, by={}, recipes={}, links={}", userId, requesterId, recipes, links);
    }

    @Transactional
    public void changePassword(Long userId, UserPasswordChangeRequestDto dto) {
        User user = getEntity(userId);
        if (!passwordEncoder.matches(dto.getCurrentPassword(), user.getPasswordHash())) {
            throw new CustomException(ErrorCode.INVALID_CURRENT_PASSWORD);
        }
        user.changePassword(passwordEncoder.encode(dto.getNewPassword()));
        log.info("Password changed: userId={}", userId);
    }

    private User getEntity(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
    }

    private static String normalizeEmail(String email) {
        return email.strip().toLowerCase(Locale.ROOT);
    }
}
