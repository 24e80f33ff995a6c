package com.questhub.engineservice.engine.core;

/**
 * 状态快照接口。
 * - 必须可 copy：命令在工作副本上执行，提交前不影响会话状态；
 * - 撤销/重做记录的前后快照也依赖深拷贝，避免与实时状态共享引用。
 */
public interface Snapshot<T extends Snapshot<T>> {

    /**
     * 返回当前状态的深拷贝快照。
     */
    T copy();
}
