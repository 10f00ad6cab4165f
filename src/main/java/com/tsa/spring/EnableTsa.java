package com.tsa.spring;

import com.tsa.adapter.spring.TsaAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable condition analysis in a Spring Boot application.
 * 
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableTsa
 * public class MyApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyApplication.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(TsaAutoConfiguration.class)
public @interface EnableTsa {
}
