package io.github.davidhlp.spring.cache.rediscluster.store;

/** 存储向宿主缓存框架声明的能力。 */
public enum StoreFeature {

    /** 写入成功的数据在被删除或清空前一定能读到 */
    DATA_GUARANTEE,

    /** 读取返回反序列化后的副本，不共享可变引用 */
    DEREFERENCES_OBJECTS
}
