package com.yhy.extrusion.service.strategy;

import com.yhy.extrusion.heuristic.FirstFitDecreasingPacker;
import com.yhy.extrusion.vo.AlgorithmMode;
import org.springframework.stereotype.Service;

@Service
public class FfdStrategy extends HeuristicStrategy {

    public FfdStrategy() {
        super(new FirstFitDecreasingPacker());
    }

    @Override
    public AlgorithmMode getMode() {
        return AlgorithmMode.FFD;
    }
}
