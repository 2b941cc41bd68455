package org.springaicommunity.github.chronicle;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("UserCollectionService Tests")
@ExtendWith(MockitoExtension.class)
class UserCollectionServiceTest {

	private static final LocalDate FROM = LocalDate.of(2024, 6, 1);

	private static final LocalDate TO = LocalDate.of(2024, 6, 7);

	@Mock
	private MemberActivityCollector collector;

	private UserCollectionService service;

	@BeforeEach
	void setUp() {
		service = new UserCollectionService(collector, new WorkerPools(new WorkerPool("stats", 1),
				new WorkerPool("member", 1), new WorkerPool("scrape", 1)));
	}

	@AfterEach
	void tearDown() {
		service.close();
	}

	@Test
	@DisplayName("Should gather the full profile by default")
	void shouldCollectFullProfile() {
		MemberActivity activity = MemberActivity.failed("alice");
		when(collector.collect("alice", FROM, TO)).thenReturn(activity);

		assertThat(service.collect(ChronicleRequest.builder().user("alice").since(FROM).until(TO).build()))
			.isSameAs(activity);
	}

	@Test
	@DisplayName("Should gather the light profile in light mode")
	void shouldCollectLightProfile() {
		when(collector.collectLight("alice", FROM, TO)).thenReturn(MemberActivity.failed("alice"));

		service.collect(ChronicleRequest.builder().user("alice").since(FROM).until(TO).lightMode(true).build());

		verify(collector, never()).collect(anyString(), any(), any());
	}

	@Test
	@DisplayName("Should reject an organization request")
	void shouldRejectOrganizationRequest() {
		assertThatIllegalArgumentException()
			.isThrownBy(() -> service.collect(ChronicleRequest.builder().organization("w3c").build()));
	}

}
