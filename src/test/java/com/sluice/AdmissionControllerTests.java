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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;

/*
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AdmissionControllerTests {
	@Test
	public void admits_up_to_slot_count_then_rejects() {
		AdmissionController admissionController = AdmissionController.withSlots(2);

		Optional<AdmissionController.Admission> first = admissionController.tryAdmit();
		Optional<AdmissionController.Admission> second = admissionController.tryAdmit();
		Optional<AdmissionController.Admission> third = admissionController.tryAdmit();

		Assertions.assertTrue(first.isPresent());
		Assertions.assertTrue(second.isPresent());
		Assertions.assertTrue(third.isEmpty(), "No slot should be available");
		Assertions.assertEquals(2, admissionController.getOccupiedSlots());
		Assertions.assertEquals(0, admissionController.getAvailableSlots());
	}

	@Test
	public void closing_admission_frees_slot_exactly_once() {
		AdmissionController admissionController = AdmissionController.withSlots(1);
		AdmissionController.Admission admission = admissionController.tryAdmit().orElseThrow();

		Assertions.assertTrue(admissionController.tryAdmit().isEmpty());

		admission.close();
		admission.close();

		Assertions.assertTrue(admission.isReleased());
		Assertions.assertEquals(1, admissionController.getAvailableSlots(), "Double close must not create extra slots");
		Assertions.assertTrue(admissionController.tryAdmit().isPresent());
	}

	@Test
	public void try_with_resources_releases_slot() {
		AdmissionController admissionController = AdmissionController.withSlots(1);

		try (AdmissionController.Admission ignored = admissionController.tryAdmit().orElseThrow()) {
			Assertions.assertEquals(1, admissionController.getOccupiedSlots());
		}

		Assertions.assertEquals(0, admissionController.getOccupiedSlots());
	}

	@Test
	public void slot_count_must_be_positive() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> AdmissionController.withSlots(0));
	}
}
