package com.mycompany.kvfs.POJO;

import lombok.Value;

import static com.mycompany.kvfs.constant.GlobalConstant.DEFAULT_GID;
import static com.mycompany.kvfs.constant.GlobalConstant.DEFAULT_UID;

/**
 * Identity stamped on newly created metadata records.
 */
@Value
public class Owner {
    public static final Owner DEFAULT = new Owner(DEFAULT_UID, DEFAULT_GID);

    int uid;
    int gid;
}
