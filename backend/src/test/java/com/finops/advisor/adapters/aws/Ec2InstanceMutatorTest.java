package com.finops.advisor.adapters.aws;

import com.finops.advisor.adapters.MutationResult;
import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.ResourceCandidate;
import com.finops.advisor.domain.model.ResourceKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.internal.waiters.ResponseOrException;
import software.amazon.awssdk.core.waiters.WaiterResponse;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.Ec2Exception;
import software.amazon.awssdk.services.ec2.model.ModifyInstanceAttributeRequest;
import software.amazon.awssdk.services.ec2.model.StartInstancesRequest;
import software.amazon.awssdk.services.ec2.model.StopInstancesRequest;
import software.amazon.awssdk.services.ec2.waiters.Ec2Waiter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class Ec2InstanceMutatorTest {

    @Mock
    private Ec2Client ec2Client;

    @Mock
    private Ec2Waiter waiter;

    private Ec2InstanceMutator mutator;

    @BeforeEach
    void setUp() {
        mutator = new Ec2InstanceMutator(ec2Client);
    }

    @Test
    @DisplayName("Stopping an idle instance issues a single stop call")
    void shouldStopInstance() {
        MutationResult result = mutator.apply(RemediationActionType.STOP_IDLE_INSTANCES, instance("m5.xlarge"));

        assertThat(result.success()).isTrue();
        verify(ec2Client).stopInstances(StopInstancesRequest.builder().instanceIds("i-1").build());
    }

    @Test
    @DisplayName("An instance that is already gone is a failure, not an exception")
    void shouldReportMissingInstance() {
        when(ec2Client.stopInstances(any(StopInstancesRequest.class)))
                .thenThrow(Ec2Exception.builder()
                        .awsErrorDetails(AwsErrorDetails.builder()
                                .errorCode("InvalidInstanceID.NotFound")
                                .errorMessage("The instance ID 'i-1' does not exist")
                                .build())
                        .statusCode(400)
                        .build());

        MutationResult result = mutator.apply(RemediationActionType.STOP_IDLE_INSTANCES, instance("t2.micro"));

        assertThat(result.success()).isFalse();
        assertThat(result.reason()).startsWith("InvalidInstanceID.NotFound");
    }

    @Nested
    @DisplayName("Rightsizing")
    class Rightsizing {

        @Test
        @DisplayName("Stops, waits, changes the type one size down, then starts")
        void shouldResizeInOrder() {
            // Given
            WaiterResponse<DescribeInstancesResponse> stopped =
                    waiterResponse(ResponseOrException.response(DescribeInstancesResponse.builder().build()));
            when(ec2Client.waiter()).thenReturn(waiter);
            when(waiter.waitUntilInstanceStopped(any(DescribeInstancesRequest.class))).thenReturn(stopped);

            // When
            MutationResult result = mutator.apply(RemediationActionType.OPTIMIZE_INSTANCE_TYPES, instance("m5.2xlarge"));

            // Then
            assertThat(result.success()).isTrue();
            InOrder order = inOrder(ec2Client, waiter);
            order.verify(ec2Client).stopInstances(any(StopInstancesRequest.class));
            order.verify(waiter).waitUntilInstanceStopped(any(DescribeInstancesRequest.class));
            ArgumentCaptor<ModifyInstanceAttributeRequest> modify =
                    ArgumentCaptor.forClass(ModifyInstanceAttributeRequest.class);
            order.verify(ec2Client).modifyInstanceAttribute(modify.capture());
            order.verify(ec2Client).startInstances(any(StartInstancesRequest.class));
            assertThat(modify.getValue().instanceType().value()).isEqualTo("m5.xlarge");
        }

        @Test
        @DisplayName("An instance that does not stop is left alone and reported")
        void shouldNotModifyWhenInstanceDidNotStop() {
            WaiterResponse<DescribeInstancesResponse> stuck =
                    waiterResponse(ResponseOrException.exception(new IllegalStateException("stuck")));
            when(ec2Client.waiter()).thenReturn(waiter);
            when(waiter.waitUntilInstanceStopped(any(DescribeInstancesRequest.class))).thenReturn(stuck);

            MutationResult result = mutator.apply(RemediationActionType.OPTIMIZE_INSTANCE_TYPES, instance("c5.xlarge"));

            assertThat(result.success()).isFalse();
            assertThat(result.reason()).isEqualTo("Instance i-1 did not stop");
            verify(ec2Client, never()).modifyInstanceAttribute(any(ModifyInstanceAttributeRequest.class));
            verify(ec2Client, never()).startInstances(any(StartInstancesRequest.class));
        }

        @Test
        @DisplayName("Smallest supported size is reported without touching the instance")
        void shouldRejectSmallestSize() {
            MutationResult result = mutator.apply(RemediationActionType.OPTIMIZE_INSTANCE_TYPES, instance("m5.large"));

            assertThat(result.success()).isFalse();
            verifyNoInteractions(ec2Client);
        }
    }

    private static ResourceCandidate instance(String type) {
        return ResourceCandidate.builder()
                .id("i-1")
                .kind(ResourceKind.COMPUTE_INSTANCE)
                .state("running")
                .instanceType(type)
                .build();
    }

    @SuppressWarnings("unchecked")
    private static WaiterResponse<DescribeInstancesResponse> waiterResponse(
            ResponseOrException<DescribeInstancesResponse> matched) {
        WaiterResponse<DescribeInstancesResponse> response = mock(WaiterResponse.class);
        when(response.matched()).thenReturn(matched);
        return response;
    }
}
