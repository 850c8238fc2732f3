package com.registry.api.security;

import com.registry.core.model.Actor;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds the {@link Actor} controller argument from the identity headers set by
 * the authenticating gateway.
 */
@Component
public class ActorArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String ACTOR_ID_HEADER = "X-Actor-Id";
    public static final String ACTOR_NAME_HEADER = "X-Actor-Name";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return Actor.class.equals(parameter.getParameterType());
    }

    @Override
    public Actor resolveArgument(MethodParameter parameter,
                                 ModelAndViewContainer mavContainer,
                                 NativeWebRequest webRequest,
                                 WebDataBinderFactory binderFactory) {
        String id = webRequest.getHeader(ACTOR_ID_HEADER);
        if (id == null || id.isBlank()) {
            throw new UnauthenticatedException("Missing " + ACTOR_ID_HEADER + " header");
        }
        return new Actor(id.trim(), webRequest.getHeader(ACTOR_NAME_HEADER));
    }
}
