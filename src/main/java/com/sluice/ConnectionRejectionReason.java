/*
 * Copyright 2022-2026 Revetware LLC.
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

package com.sluice;

/**
 * Why a connection was answered without being handed to the request pipeline.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum ConnectionRejectionReason {
	/**
	 * Every worker slot was occupied (answered with 429).
	 */
	NO_WORKER_SLOT_AVAILABLE,
	/**
	 * The worker executor refused the task, e.g. because the server is stopping (answered with 503).
	 */
	SERVER_STOPPING
}
