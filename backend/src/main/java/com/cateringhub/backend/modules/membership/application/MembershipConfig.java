package com.cateringhub.backend.modules.membership.application;

import com.cateringhub.backend.modules.membership.domain.RoleHierarchy;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MembershipConfig {

    @Bean
    public RoleHierarchy roleHierarchy() {
        return RoleHierarchy.standard();
    }
}
