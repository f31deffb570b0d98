package com.chirm.chatapp.security;

import com.chirm.chatapp.service.JwtService;
import java.util.List;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * principal 이름을 user_id claim 으로 설정한다 (없으면 sub).
 */
@Component
public class UserIdJwtAuthenticationConverter implements Converter<Jwt, AbstractAuthenticationToken> {

    @Override
    public AbstractAuthenticationToken convert(Jwt jwt) {
        String userId = jwt.getClaimAsString(JwtService.USER_ID_CLAIM);
        return new JwtAuthenticationToken(jwt, List.of(), userId != null ? userId : jwt.getSubject());
    }
}
