/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.quotaclient.youtube;

import org.jspecify.annotations.Nullable;

/**
 * Supplies the OAuth bearer token for each request. Acquiring, storing and
 * refreshing it is someone else's job.
 */
public interface CredentialProvider {
  /**
   * The current access token, or null to send the request unauthenticated.
   */
  @Nullable
  String accessToken();

  /**
   * The API refused the token. Implementations typically discard it and force
   * the user to sign in again.
   */
  default void onCredentialRejected(AuthFailureException failure) {
  }
}
