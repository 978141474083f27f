package com.example.dutyroster.person;

/**
 * ロール所属の問い合わせ口。アカウント管理側の実装に差し替え可能。
 */
public interface RoleDirectory {

    boolean hasRole(Long personId, Role role);
}
