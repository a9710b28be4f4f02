package com.jotter.user.mapper;

import com.jotter.user.domain.User;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;

@Mapper
public interface UserMapper {

    User findById(@Param("id") Long id);

    /**
     * 按邮箱查询，调用方负责传入已归一化（trim + 小写）的邮箱。
     */
    User findByEmail(@Param("email") String email);

    boolean existsByEmail(@Param("email") String email);

    /**
     * 插入用户，依赖 email 唯一索引做重复检测；主键回填到 {@code user.id}。
     */
    int insert(User user);

    /**
     * 覆盖资料与凭据字段。is_verified 只会由 0 变 1；OTP 列只由 {@link #updateOtp} 与
     * {@link #completeVerification} 维护，这里不写。
     */
    int update(User user);

    /**
     * 同一条语句覆盖 OTP 码与过期时间。
     */
    int updateOtp(@Param("id") Long id,
                  @Param("otpCode") String otpCode,
                  @Param("otpExpiry") Instant otpExpiry);

    /**
     * 仅当当前存储的 OTP 仍为 {@code otpCode} 时，标记已验证并清除 OTP。
     *
     * @return 影响行数，0 表示挑战已被覆盖或已被消费
     */
    int completeVerification(@Param("id") Long id,
                             @Param("otpCode") String otpCode,
                             @Param("updatedAt") Instant updatedAt);

    int updatePassword(@Param("id") Long id,
                       @Param("passwordHash") String passwordHash,
                       @Param("updatedAt") Instant updatedAt);
}
