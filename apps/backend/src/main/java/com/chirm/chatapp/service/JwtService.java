package com.chirm.chatapp.service;

import lombok.RequiredArgsConstructor;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

/**
 * 토큰 검증. 토큰 발급은 인증 서비스 쪽 책임이다.
 */
@Service
@RequiredArgsConstructor
public class JwtService {

    public static final String USER_ID_CLAIM = "user_id";

    private final JwtDecoder jwtDecoder;

    /**
     * 토큰을 검증하고 사용자 ID 를 꺼낸다.
     * user_id claim 이 없으면 sub 를 사용한다.
     *
     * @throws JwtException 서명/만료 검증 실패 또는 사용자 ID 없음
     */
    public String extractUserId(String token) {
        Jwt jwt = jwtDecoder.decode(token);
        String userId = jwt.getClaimAsString(USER_ID_CLAIM);
        if (userId == null || userId.isBlank()) {
            userId = jwt.getSubject();
        }
        if (userId == null || userId.isBlank()) {
            throw new BadJwtException("Token has no user id");
        }
        return userId;
    }
}
