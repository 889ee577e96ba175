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
 
package io.permaudit.spi.client;

import java.util.Map;

import io.permaudit.spi.content.ContentServiceClient;
import io.permaudit.spi.directory.DirectoryServiceClient;

/**
 * Creates the service clients used by a run. Implementations are named in the settings and created
 * reflectively, so they need a public no-arg constructor.
 */
public interface AuditClientProvider {
  /** Initializes the provider with the {@code clientProvider.configuration} settings. */
  void init(Map<String, String> configuration);

  ContentServiceClient getContentServiceClient();

  DirectoryServiceClient getDirectoryServiceClient();
}
