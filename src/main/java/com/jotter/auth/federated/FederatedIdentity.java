package com.jotter.auth.federated;

/**
 * 外部身份提供方校验通过后的最小声明集合。
 *
 * @param subject 提供方内的用户标识（Google 的 {@code sub}）
 * @param email 邮箱（必有）
 * @param name 展示名
 */
public record FederatedIdentity(String subject, String email, String name) {
}
