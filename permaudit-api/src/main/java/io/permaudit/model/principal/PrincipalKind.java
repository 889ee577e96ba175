/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
 
package io.permaudit.model.principal;

/**
 * Kind of a principal as reported by the content or directory service. Resolution decides between
 * expanding a principal and emitting it as an account from this value alone.
 */
public enum PrincipalKind {
  /** An individual account. */
  USER,

  /** A group whose membership is local to one site collection. */
  SITE_GROUP,

  /** A tenant-wide security group from the directory. */
  SECURITY_GROUP,

  /** A tenant-wide Microsoft 365 group from the directory. */
  M365_GROUP;

  public boolean isGroup() {
    return this != USER;
  }

  public boolean isDirectoryGroup() {
    return this == SECURITY_GROUP || this == M365_GROUP;
  }
}
