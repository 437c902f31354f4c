package com.cronium.runtime.auth;

import com.cronium.runtime.error.ApiException;
import com.cronium.runtime.error.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Lets controller methods declare an {@link ExecutionClaims} parameter and
 * receive the claims verified by {@link TokenAuthenticationFilter}.
 */
@Component
public class ExecutionClaimsArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return ExecutionClaims.class.equals(parameter.getParameterType());
    }

    @Override
    public ExecutionClaims resolveArgument(MethodParameter parameter,
                                           ModelAndViewContainer mavContainer,
                                           NativeWebRequest webRequest,
                                           WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        if (request == null) {
            throw new ApiException(ErrorCode.UNAUTHENTICATED, "No authenticated execution");
        }
        return RequestClaims.get(request).orElseThrow(() ->
                new ApiException(ErrorCode.UNAUTHENTICATED, "No authenticated execution"));
    }
}
