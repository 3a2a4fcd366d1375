package com.flagship.erp_ledger.config;

import com.flagship.erp_ledger.common.TenantScope;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.UUID;

/**
 * Builds a {@link TenantScope} for controller methods from the tenant headers.
 */
public class TenantScopeArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return TenantScope.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory)
            throws MissingRequestHeaderException {
        String business = webRequest.getHeader(TenantScope.BUSINESS_HEADER);
        if (business == null || business.isBlank()) {
            throw new MissingRequestHeaderException(TenantScope.BUSINESS_HEADER, parameter);
        }
        UUID businessId = parseHeader(TenantScope.BUSINESS_HEADER, business);
        UUID branchId = parseOptional(TenantScope.BRANCH_HEADER, webRequest.getHeader(TenantScope.BRANCH_HEADER));
        UUID userId = parseOptional(TenantScope.USER_HEADER, webRequest.getHeader(TenantScope.USER_HEADER));

        return TenantScope.of(businessId, branchId, userId);
    }

    private UUID parseOptional(String header, String value) {
        return value == null || value.isBlank() ? null : parseHeader(header, value);
    }

    private UUID parseHeader(String header, String value) {
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Header " + header + " must be a UUID");
        }
    }
}
