package com.snapshotclaim.domain;

import com.mongodb.ClientSessionOptions;
import com.mongodb.client.ClientSession;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.ConvertOperators;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Implementation of ClaimRepositoryCustom using MongoTemplate.
 */
@Repository
@RequiredArgsConstructor
public class ClaimRepositoryImpl implements ClaimRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public BigInteger sumClaimedBalances() {
        // $sum over int64 degrades to double on overflow; summing as Decimal128 stays exact
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.group()
                        .sum(ConvertOperators.valueOf("claimedBalance").convertToDecimal())
                        .as("total"));
        ClaimBalanceTotal result = mongoTemplate
                .aggregate(aggregation, Claim.class, ClaimBalanceTotal.class)
                .getUniqueMappedResult();
        if (result == null || result.getTotal() == null) {
            return BigInteger.ZERO;
        }
        BigDecimal total = result.getTotal();
        return total.stripTrailingZeros().toBigIntegerExact();
    }

    @Override
    public List<Claim> findSlice(Sort sort, Long offset, Integer limit) {
        Query query = new Query().with(sort);
        if (offset != null && offset > 0) {
            query.skip(offset);
        }
        if (limit != null && limit > 0) {
            query.limit(limit);
        }
        return mongoTemplate.find(query, Claim.class);
    }

    @Override
    public List<Claim> findAllConsistent(Sort sort, boolean snapshotSession) {
        Query query = new Query().with(sort);
        if (!snapshotSession) {
            return mongoTemplate.find(query, Claim.class);
        }
        ClientSessionOptions options = ClientSessionOptions.builder().snapshot(true).build();
        return mongoTemplate.withSession(options)
                .execute(operations -> operations.find(query, Claim.class), ClientSession::close);
    }
}
