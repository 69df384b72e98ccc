package com.mycompany.kvfs.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString(of = "desc")
public enum ErrorCode {
  INVALID_ARGUMENT(22, 400, "Invalid Argument"),
  UNAUTHORIZED(13, 401, "Unauthorized"),
  NOT_FOUND(2, 404, "Not Found"),
  IS_A_DIRECTORY(21, 400, "Is A Directory"),
  NOT_A_DIRECTORY(20, 400, "Not A Directory"),
  CONFLICT(17, 409, "Conflict"),
  DIRECTORY_NOT_EMPTY(66, 400, "Directory Not Empty"),
  CORRUPT_METADATA(10006, 500, "Corrupt Metadata"),
  STORE_ERROR(5, 500, "Store Error");

  // errno-style code, mirrors the NFS3 status numbering where one exists
  private final int code;
  private final int httpStatus;
  private final String desc;
}
