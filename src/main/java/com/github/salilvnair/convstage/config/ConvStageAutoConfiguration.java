package com.github.salilvnair.convstage.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@AutoConfiguration
@AutoConfigurationPackage(basePackages = "com.github.salilvnair.convstage")
@ComponentScan(basePackages = "com.github.salilvnair.convstage")
@EntityScan(basePackages = "com.github.salilvnair.convstage.entity")
@EnableJpaRepositories(basePackages = "com.github.salilvnair.convstage.repo")
public class ConvStageAutoConfiguration {
}
