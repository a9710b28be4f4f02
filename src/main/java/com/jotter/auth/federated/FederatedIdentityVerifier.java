package com.jotter.auth.federated;

/**
 * 联合身份断言校验器。
 * <p>
 * 签名校验委托给身份提供方公开的校验流程，本接口只消费校验通过的声明。
 * 断言无效（受众不符、已过期、缺少邮箱等）时抛出 {@code BusinessException(ErrorCode.INVALID_TOKEN)}。
 */
public interface FederatedIdentityVerifier {

    FederatedIdentity verify(String idToken);
}
