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
 
package io.permaudit.reflection;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import io.permaudit.model.exception.ConfigurationException;

/** Creates providers, sinks and job sources from class names found in settings. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class ReflectionUtils {

  /**
   * Loads {@code className} and creates an instance through its public no-arg constructor.
   *
   * @param className fully qualified class name
   * @param expectedType the interface the class must implement
   * @return the new instance
   * @throws ConfigurationException if the class is missing, of the wrong type or not instantiable
   */
  public static <T> T createInstanceOfClass(String className, Class<T> expectedType) {
    Class<?> clazz;
    try {
      clazz = ReflectionUtils.class.getClassLoader().loadClass(className);
    } catch (ClassNotFoundException ex) {
      throw new ConfigurationException("Class not found: " + className, ex);
    }
    if (!expectedType.isAssignableFrom(clazz)) {
      throw new ConfigurationException(
          String.format("%s does not implement %s", className, expectedType.getName()));
    }
    try {
      Constructor<?> constructor = clazz.getConstructor();
      return expectedType.cast(constructor.newInstance());
    } catch (InstantiationException
        | IllegalAccessException
        | InvocationTargetException
        | NoSuchMethodException e) {
      throw new ConfigurationException("Unable to load class: " + className, e);
    }
  }
}
