package com.agentbox.backend.configuration;

import com.agentbox.backend.entity.Instance;
import com.agentbox.backend.exception.AppException;
import com.agentbox.backend.exception.ErrorCode;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

@Component("instanceSecurity")
public class InstanceSecurity {

    public CallerIdentity currentCaller() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.getPrincipal() instanceof CallerIdentity caller) {
            return caller;
        }
        throw new AppException(ErrorCode.UNAUTHENTICATED);
    }

    public boolean isAdmin(CallerIdentity caller) {
        return caller != null && caller.isAdmin();
    }

    public boolean isOwner(Instance instance, CallerIdentity caller) {
        if (instance == null || caller == null) return false;
        return isAdmin(caller) || (caller.getWallet() != null && caller.getWallet().equals(instance.getOwnerWallet()));
    }

    /** 403 unless the current caller may act on the instance. */
    public CallerIdentity requireOwner(Instance instance) {
        CallerIdentity caller = currentCaller();
        if (!isOwner(instance, caller)) throw new AppException(ErrorCode.UNAUTHORIZED);
        return caller;
    }
}
